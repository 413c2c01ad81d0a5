package com.ryuqq.tokenflow.core.guard;

/**
 * 전이 가드 판정 결과.
 *
 * <p>GuardDecision은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Allowed}: 전이 허용</li>
 *   <li>{@link Denied}: 전이 거부 (사유 종류와 메시지 포함)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 가드는 예외 대신 항상 판정 결과를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GuardDecision decision = guard.canTransition(token, TokenStatus.DEPLOYED);
 * if (decision instanceof Denied denied) {
 *     render(denied.kind(), denied.reason());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface GuardDecision permits GuardDecision.Allowed, GuardDecision.Denied {

    /**
     * 전이 허용 여부 확인.
     *
     * @return 허용이면 true
     */
    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    /**
     * 허용 판정 (싱글톤).
     *
     * @return Allowed 인스턴스
     */
    static GuardDecision allowed() {
        return Allowed.INSTANCE;
    }

    /**
     * 거부 판정 생성.
     *
     * @param kind 거부 종류
     * @param reason 사람이 읽을 수 있는 사유
     * @return Denied 인스턴스
     */
    static GuardDecision denied(DenialKind kind, String reason) {
        return new Denied(kind, reason);
    }

    /**
     * 전이 허용.
     */
    final class Allowed implements GuardDecision {

        private static final Allowed INSTANCE = new Allowed();

        private Allowed() {
        }

        @Override
        public String toString() {
            return "Allowed";
        }
    }

    /**
     * 전이 거부.
     *
     * @param kind 거부 종류
     * @param reason 사람이 읽을 수 있는 사유
     */
    record Denied(DenialKind kind, String reason) implements GuardDecision {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException kind가 null이거나 reason이 비어 있는 경우
         */
        public Denied {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
