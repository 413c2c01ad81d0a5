package com.ryuqq.tokenflow.application.command;

/**
 * 상태 변경 실패.
 *
 * <p><strong>실패 분류와 권장 표시 방식:</strong></p>
 * <ul>
 *   <li>{@link NotFound}: 토큰 없음 (복구 불가 실패)</li>
 *   <li>{@link IllegalTransition}: 허용되지 않은 전이 (입력 검증 메시지)</li>
 *   <li>{@link Conflict}: 로드 이후 다른 전이가 먼저 커밋됨 ("변경되었습니다, 다시 시도하세요")</li>
 *   <li>{@link PersistenceFailure}: 저장소 적용 실패 (재시도 가능한 일반 오류)</li>
 * </ul>
 *
 * <p>모든 실패에서 토큰과 감사 로그는 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface UpdateError extends UpdateOutcome
    permits NotFound, IllegalTransition, Conflict, PersistenceFailure {

    /**
     * 사람이 읽을 수 있는 실패 사유.
     *
     * @return 사유
     */
    String message();

    /**
     * 같은 요청을 다시 시도해 볼 만한지 확인.
     *
     * @return Conflict, PersistenceFailure인 경우 true
     */
    default boolean isRetryable() {
        return this instanceof Conflict || this instanceof PersistenceFailure;
    }
}
