package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.model.TokenId;

/**
 * 저장소가 변경을 적용하지 못함.
 *
 * <p>토큰과 감사 로그는 변경되지 않았음이 보장됩니다.
 * reason은 저장소 내부 정보를 노출하지 않는 짧은 메시지입니다.</p>
 *
 * @param tokenId 토큰 ID
 * @param reason 실패 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PersistenceFailure(TokenId tokenId, String reason) implements UpdateError {

    public PersistenceFailure {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
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
