package com.ryuqq.tokenflow.core.statemachine;

import java.util.Locale;
import java.util.Optional;

/**
 * 토큰의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * DRAFT
 *    │
 *    ▼ (검토 요청)
 * UNDER_REVIEW ──► REJECTED (종료)
 *    │
 *    ▼ (승인)
 * APPROVED ──────► REJECTED (종료)
 *    │
 *    ▼
 * READY_TO_MINT
 *    │
 *    ▼
 * MINTED
 *    │
 *    ▼
 * DEPLOYED ◄────► PAUSED (일시정지 / 재개)
 *    │
 *    ▼
 * DISTRIBUTED (종료)
 * </pre>
 *
 * <p>각 상태는 플랫폼 데이터베이스에 저장되는 코드를 가지며 (예: "UNDER REVIEW"),
 * {@link #fromCode(String)}로 저장 코드와 별칭을 해석합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see TransitionTable
 */
public enum TokenStatus {

    /**
     * 작성 중 (모든 토큰의 시작 상태).
     */
    DRAFT("DRAFT"),

    /**
     * 검토 중.
     */
    UNDER_REVIEW("UNDER REVIEW", "REVIEW"),

    /**
     * 승인됨.
     */
    APPROVED("APPROVED"),

    /**
     * 반려됨 (종료).
     */
    REJECTED("REJECTED"),

    /**
     * 발행 준비 완료.
     */
    READY_TO_MINT("READY TO MINT"),

    /**
     * 발행됨.
     */
    MINTED("MINTED"),

    /**
     * 배포됨 (온체인 운영 중).
     */
    DEPLOYED("DEPLOYED"),

    /**
     * 일시정지.
     */
    PAUSED("PAUSED"),

    /**
     * 분배 완료 (종료).
     */
    DISTRIBUTED("DISTRIBUTED");

    private final String code;
    private final String[] aliases;

    TokenStatus(String code, String... aliases) {
        this.code = code;
        this.aliases = aliases;
    }

    /**
     * 저장소에 기록되는 상태 코드.
     *
     * @return 상태 코드 (예: "READY TO MINT")
     */
    public String code() {
        return code;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(REJECTED, DISTRIBUTED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return REJECTED 또는 DISTRIBUTED인 경우 true
     */
    public boolean isTerminal() {
        return this == REJECTED || this == DISTRIBUTED;
    }

    /**
     * 상태 코드 해석.
     *
     * <p>저장 코드("UNDER REVIEW"), enum 이름("UNDER_REVIEW"), 별칭("REVIEW")을
     * 대소문자 구분 없이 허용합니다. 알 수 없는 코드를 DRAFT로 대체하지 않습니다.</p>
     *
     * @param code 상태 코드 (null 허용)
     * @return 해석된 상태, 알 수 없는 코드면 empty
     */
    public static Optional<TokenStatus> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
        for (TokenStatus status : values()) {
            if (status.code.equals(normalized)) {
                return Optional.of(status);
            }
            for (String alias : status.aliases) {
                if (alias.equals(normalized)) {
                    return Optional.of(status);
                }
            }
        }
        return Optional.empty();
    }
}
