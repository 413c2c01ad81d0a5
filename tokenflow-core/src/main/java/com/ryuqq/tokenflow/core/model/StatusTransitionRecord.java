package com.ryuqq.tokenflow.core.model;

import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.time.Instant;

/**
 * 상태 전이 감사 기록.
 *
 * <p>성공한 상태 전이 하나당 정확히 하나의 기록이 추가됩니다.
 * 기록은 추가만 가능하며, 수정되거나 삭제되지 않습니다.</p>
 *
 * @param tokenId 토큰 ID
 * @param fromStatus 전이 전 상태
 * @param toStatus 전이 후 상태
 * @param actorId 수행자 ID (선택, null 가능)
 * @param notes 메모 (선택, null 가능)
 * @param occurredAt 전이 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatusTransitionRecord(
    TokenId tokenId,
    TokenStatus fromStatus,
    TokenStatus toStatus,
    String actorId,
    String notes,
    Instant occurredAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 fromStatus와 toStatus가 같은 경우
     */
    public StatusTransitionRecord {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (fromStatus == null || toStatus == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + fromStatus + ", to: " + toStatus + ")");
        }
        if (fromStatus == toStatus) {
            throw new IllegalArgumentException("A transition record cannot have identical states: " + fromStatus);
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        // actorId, notes는 null 허용
    }
}
