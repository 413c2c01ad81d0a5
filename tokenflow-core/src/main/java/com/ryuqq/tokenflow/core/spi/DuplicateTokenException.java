package com.ryuqq.tokenflow.core.spi;

import com.ryuqq.tokenflow.core.model.TokenId;

/**
 * Thrown when inserting a token whose ID already exists.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateTokenException extends TokenStoreException {

    private final transient TokenId tokenId;

    public DuplicateTokenException(TokenId tokenId) {
        super("Token already exists: " + tokenId);
        this.tokenId = tokenId;
    }

    /**
     * Returns the duplicated token ID.
     *
     * @return the token ID
     */
    public TokenId getTokenId() {
        return tokenId;
    }
}
