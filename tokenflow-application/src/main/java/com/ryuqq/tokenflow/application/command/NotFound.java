package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.model.TokenId;

/**
 * 토큰 ID에 해당하는 토큰 없음.
 *
 * @param tokenId 요청된 토큰 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NotFound(TokenId tokenId) implements UpdateError {

    public NotFound {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
    }

    @Override
    public String message() {
        return "Token not found: " + tokenId.getValue();
    }
}
