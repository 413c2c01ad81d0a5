package com.ryuqq.tokenflow.core.statemachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.tokenflow.core.statemachine.TokenStatus.*;

/**
 * 토큰 상태 전이표.
 *
 * <p>상태별로 허용되는 다음 상태 집합을 반환하는 순수 함수입니다.
 * 모든 상태(종료 상태 포함)에 대해 정의되어 있으며, 결과는 호출마다 동일합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>DRAFT → UNDER_REVIEW</li>
 *   <li>UNDER_REVIEW → APPROVED, REJECTED</li>
 *   <li>APPROVED → READY_TO_MINT, REJECTED</li>
 *   <li>READY_TO_MINT → MINTED</li>
 *   <li>MINTED → DEPLOYED</li>
 *   <li>DEPLOYED → PAUSED, DISTRIBUTED</li>
 *   <li>PAUSED → DEPLOYED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(REJECTED, DISTRIBUTED)의 다음 상태 집합은 비어 있음</li>
 *   <li>자기 자신으로의 전이 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionTable {

    private static final Map<TokenStatus, Set<TokenStatus>> EDGES = buildEdges();

    // Utility class - prevent instantiation
    private TransitionTable() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static Map<TokenStatus, Set<TokenStatus>> buildEdges() {
        Map<TokenStatus, Set<TokenStatus>> edges = new EnumMap<>(TokenStatus.class);
        for (TokenStatus from : TokenStatus.values()) {
            Set<TokenStatus> next = switch (from) {
                case DRAFT -> EnumSet.of(UNDER_REVIEW);
                case UNDER_REVIEW -> EnumSet.of(APPROVED, REJECTED);
                case APPROVED -> EnumSet.of(READY_TO_MINT, REJECTED);
                case READY_TO_MINT -> EnumSet.of(MINTED);
                case MINTED -> EnumSet.of(DEPLOYED);
                case DEPLOYED -> EnumSet.of(PAUSED, DISTRIBUTED);
                case PAUSED -> EnumSet.of(DEPLOYED);
                case REJECTED, DISTRIBUTED -> EnumSet.noneOf(TokenStatus.class);
            };
            edges.put(from, Collections.unmodifiableSet(next));
        }
        return Collections.unmodifiableMap(edges);
    }

    /**
     * 허용되는 다음 상태 집합 조회.
     *
     * <p>반환 집합은 수정 불가이며 enum 선언 순서로 정렬되어 있습니다.
     * null 입력은 빈 집합을 반환합니다 (fail-closed).</p>
     *
     * @param status 현재 상태
     * @return 다음 상태 집합 (비어 있을 수 있음)
     */
    public static Set<TokenStatus> legalNextStates(TokenStatus status) {
        if (status == null) {
            return Collections.emptySet();
        }
        return EDGES.get(status);
    }

    /**
     * 전이가 전이표에 존재하는지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 간선이면 true
     */
    public static boolean isLegal(TokenStatus from, TokenStatus to) {
        return to != null && legalNextStates(from).contains(to);
    }

    /**
     * 전이표의 모든 간선 조회 (출발 상태 선언 순서).
     *
     * @return 간선 목록 (수정 불가)
     */
    public static List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        EDGES.forEach((from, targets) -> targets.forEach(to -> result.add(new Edge(from, to))));
        return Collections.unmodifiableList(result);
    }

    /**
     * 전이표의 간선 하나.
     *
     * @param from 출발 상태
     * @param to 도착 상태
     */
    public record Edge(TokenStatus from, TokenStatus to) {

        @Override
        public String toString() {
            return from + " → " + to;
        }
    }
}
