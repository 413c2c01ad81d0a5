package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

/**
 * 상태 전이 성공.
 *
 * <p>호출자는 재조회 없이 캐시된 화면을 갱신할 수 있도록 이전/새 상태를 받습니다.</p>
 *
 * @param tokenId 토큰 ID
 * @param previousStatus 전이 전 상태
 * @param newStatus 전이 후 상태
 * @param record 추가된 감사 기록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatusChanged(
    TokenId tokenId,
    TokenStatus previousStatus,
    TokenStatus newStatus,
    StatusTransitionRecord record
) implements UpdateOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 기록과 일치하지 않는 경우
     */
    public StatusChanged {
        if (tokenId == null || previousStatus == null || newStatus == null || record == null) {
            throw new IllegalArgumentException("StatusChanged fields cannot be null");
        }
        if (record.fromStatus() != previousStatus || record.toStatus() != newStatus) {
            throw new IllegalArgumentException(
                "record must match the transition (" + previousStatus + " → " + newStatus + "), but was: " + record);
        }
    }
}
