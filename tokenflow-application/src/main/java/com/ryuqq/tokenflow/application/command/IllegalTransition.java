package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.guard.DenialKind;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

/**
 * 허용되지 않은 전이.
 *
 * <p>전이표에 없는 전이, 종료 상태에서의 전이, 같은 상태로의 전이,
 * 전제조건 불충족을 모두 포함하며 {@link #kind()}로 구분합니다.</p>
 *
 * @param tokenId 토큰 ID
 * @param fromStatus 현재 상태
 * @param toStatus 요청된 상태
 * @param kind 거부 종류
 * @param reason 사람이 읽을 수 있는 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record IllegalTransition(
    TokenId tokenId,
    TokenStatus fromStatus,
    TokenStatus toStatus,
    DenialKind kind,
    String reason
) implements UpdateError {

    public IllegalTransition {
        if (tokenId == null || fromStatus == null || toStatus == null || kind == null) {
            throw new IllegalArgumentException("IllegalTransition fields cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    @Override
    public String message() {
        return reason;
    }
}
