package com.ryuqq.tokenflow.application.command;

/**
 * 상태 변경 결과.
 *
 * <p>UpdateOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link StatusChanged}: 전이 커밋 완료 (이전/새 상태와 감사 기록 포함)</li>
 *   <li>{@link UpdateError}: 실패 ({@link NotFound}, {@link IllegalTransition},
 *       {@link Conflict}, {@link PersistenceFailure})</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 커맨드는 런타임 실패를 예외 대신 결과로 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UpdateOutcome outcome = command.updateStatus(tokenId, TokenStatus.PAUSED);
 * if (outcome instanceof StatusChanged changed) {
 *     view.update(changed.newStatus());
 * } else if (outcome instanceof Conflict) {
 *     view.showRetry("This token changed, please retry");
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface UpdateOutcome permits StatusChanged, UpdateError {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof StatusChanged;
    }
}
