package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

/**
 * 상태 변경 요청.
 *
 * <p>actorId와 notes는 호출자 컨텍스트에서 전달되며,
 * 검증 없이 감사 기록에 그대로 기록됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * UpdateStatusRequest request = UpdateStatusRequest.of(tokenId, TokenStatus.UNDER_REVIEW)
 *     .withActor("user-42")
 *     .withNotes("Ready for compliance review");
 * </pre>
 *
 * @param tokenId 토큰 ID
 * @param toStatus 대상 상태
 * @param actorIdOrNull 수행자 ID (선택, null 가능)
 * @param notesOrNull 메모 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record UpdateStatusRequest(
    TokenId tokenId,
    TokenStatus toStatus,
    String actorIdOrNull,
    String notesOrNull
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException tokenId 또는 toStatus가 null인 경우
     */
    public UpdateStatusRequest {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (toStatus == null) {
            throw new IllegalArgumentException("toStatus cannot be null");
        }
        // actorIdOrNull, notesOrNull은 null 허용
    }

    /**
     * 수행자와 메모 없이 요청 생성.
     *
     * @param tokenId 토큰 ID
     * @param toStatus 대상 상태
     * @return UpdateStatusRequest
     */
    public static UpdateStatusRequest of(TokenId tokenId, TokenStatus toStatus) {
        return new UpdateStatusRequest(tokenId, toStatus, null, null);
    }

    /**
     * 수행자만 변경한 새 요청 생성.
     *
     * @param actorId 수행자 ID
     * @return 새 UpdateStatusRequest
     */
    public UpdateStatusRequest withActor(String actorId) {
        return new UpdateStatusRequest(tokenId, toStatus, actorId, notesOrNull);
    }

    /**
     * 메모만 변경한 새 요청 생성.
     *
     * @param notes 메모
     * @return 새 UpdateStatusRequest
     */
    public UpdateStatusRequest withNotes(String notes) {
        return new UpdateStatusRequest(tokenId, toStatus, actorIdOrNull, notes);
    }
}
