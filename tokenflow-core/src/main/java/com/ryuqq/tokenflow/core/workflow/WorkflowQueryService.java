package com.ryuqq.tokenflow.core.workflow;

import com.ryuqq.tokenflow.core.catalog.StatusCatalog;
import com.ryuqq.tokenflow.core.catalog.StatusDescriptor;
import com.ryuqq.tokenflow.core.guard.TransitionGuard;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import com.ryuqq.tokenflow.core.statemachine.TransitionTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 워크플로우 조회 서비스 (읽기 전용).
 *
 * <p>토큰의 현재 상태 표시 정보와 가능한 전이 목록을 계산합니다.
 * 동기식이며 I/O나 부수 효과가 없으므로 렌더링마다 호출해도 안전합니다.</p>
 *
 * <p><strong>계산 규칙:</strong></p>
 * <ul>
 *   <li>availableTransitions = legalNextStates(currentStatus) 중 전제조건을 충족하는 상태</li>
 *   <li>canTransition = availableTransitions가 비어 있지 않음</li>
 *   <li>인식할 수 없는 상태 코드: 표시 정보는 카탈로그 fallback, 가능한 전이는 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowQueryService {

    private final TransitionGuard guard;

    /**
     * 전제조건 없는 가드로 생성.
     */
    public WorkflowQueryService() {
        this(new TransitionGuard());
    }

    /**
     * 생성자.
     *
     * @param guard 전이 가드 (전제조건 필터링에 사용)
     * @throws IllegalArgumentException guard가 null인 경우
     */
    public WorkflowQueryService(TransitionGuard guard) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        this.guard = guard;
    }

    /**
     * 토큰의 워크플로우 투영 계산.
     *
     * @param token 토큰
     * @return WorkflowInfo
     * @throws IllegalArgumentException token이 null인 경우
     */
    public WorkflowInfo describe(Token token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        TokenStatus status = token.currentStatus();
        StatusDescriptor descriptor = StatusCatalog.describe(status);

        List<TokenStatus> available = new ArrayList<>();
        for (TokenStatus candidate : TransitionTable.legalNextStates(status)) {
            if (guard.checkPreconditions(token, candidate).isAllowed()) {
                available.add(candidate);
            }
        }

        return new WorkflowInfo(
            status.code(),
            status,
            descriptor.displayName(),
            descriptor.description(),
            available,
            !available.isEmpty()
        );
    }

    /**
     * 원본 상태 코드의 워크플로우 투영 계산.
     *
     * <p>토큰 스냅샷 없이 코드만 있는 경우 사용합니다. 전제조건은 토큰이 필요하므로 평가하지 않으며,
     * 전이표의 다음 상태를 그대로 반환합니다.</p>
     *
     * @param statusCode 저장소 상태 코드 (null 허용)
     * @return WorkflowInfo (인식할 수 없는 코드면 fallback, 전이 없음)
     */
    public WorkflowInfo describe(String statusCode) {
        Optional<TokenStatus> resolved = TokenStatus.fromCode(statusCode);
        if (resolved.isEmpty()) {
            StatusDescriptor fallback = StatusCatalog.fallback();
            return new WorkflowInfo(statusCode, null, fallback.displayName(), fallback.description(), List.of(), false);
        }

        TokenStatus status = resolved.get();
        StatusDescriptor descriptor = StatusCatalog.describe(status);
        List<TokenStatus> available = new ArrayList<>(TransitionTable.legalNextStates(status));
        return new WorkflowInfo(
            status.code(),
            status,
            descriptor.displayName(),
            descriptor.description(),
            available,
            !available.isEmpty()
        );
    }

    /**
     * 상태별 토큰 수 집계.
     *
     * <p>모든 상태가 결과에 포함되며, 해당 토큰이 없으면 0입니다.</p>
     *
     * @param tokens 토큰 목록
     * @return 상태 → 개수 (enum 선언 순서, 수정 불가)
     * @throws IllegalArgumentException tokens가 null인 경우
     */
    public Map<TokenStatus, Long> countByStatus(Collection<Token> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens cannot be null");
        }
        Map<TokenStatus, Long> counts = new EnumMap<>(TokenStatus.class);
        for (TokenStatus status : TokenStatus.values()) {
            counts.put(status, 0L);
        }
        for (Token token : tokens) {
            counts.merge(token.currentStatus(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
