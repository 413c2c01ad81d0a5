package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

/**
 * 가드와 감사 기록이 적용된 토큰 상태 변경 커맨드.
 *
 * <p>토큰 상태를 바꾸는 유일한 경로입니다. 프레젠테이션 레이어는 반환된 결과만 관찰합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>토큰 로드 (없으면 {@link NotFound})</li>
 *   <li>전이 가드 검증 (거부 시 {@link IllegalTransition})</li>
 *   <li>하나의 트랜잭션에서 새 상태 기록 + 감사 기록 추가</li>
 *   <li>경합 패배 시 {@link Conflict}, 저장소 실패 시 {@link PersistenceFailure}</li>
 *   <li>성공 시 {@link StatusChanged} (이전 상태, 새 상태)</li>
 * </ol>
 *
 * <p><strong>멱등성 없음:</strong> 같은 대상 상태로 다시 요청하면
 * {@link IllegalTransition} (NO_OP_TRANSITION)을 반환하여 중복 감사 기록을 방지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StatusUpdateCommand {

    /**
     * 상태 변경 실행.
     *
     * <p>런타임 실패는 예외 대신 결과로 반환됩니다. 호출자가 중간에 포기하더라도
     * 변경은 커밋되었거나 전혀 적용되지 않았거나 둘 중 하나입니다.</p>
     *
     * @param request 상태 변경 요청
     * @return 결과 (non-null)
     * @throws IllegalArgumentException request가 null인 경우
     */
    UpdateOutcome updateStatus(UpdateStatusRequest request);

    /**
     * 수행자와 메모 없이 상태 변경 실행.
     *
     * @param tokenId 토큰 ID
     * @param toStatus 대상 상태
     * @return 결과 (non-null)
     */
    default UpdateOutcome updateStatus(TokenId tokenId, TokenStatus toStatus) {
        return updateStatus(UpdateStatusRequest.of(tokenId, toStatus));
    }

    /**
     * 상태 변경 실행.
     *
     * @param tokenId 토큰 ID
     * @param toStatus 대상 상태
     * @param actorIdOrNull 수행자 ID (null 허용)
     * @param notesOrNull 메모 (null 허용)
     * @return 결과 (non-null)
     */
    default UpdateOutcome updateStatus(TokenId tokenId, TokenStatus toStatus, String actorIdOrNull, String notesOrNull) {
        return updateStatus(new UpdateStatusRequest(tokenId, toStatus, actorIdOrNull, notesOrNull));
    }
}
