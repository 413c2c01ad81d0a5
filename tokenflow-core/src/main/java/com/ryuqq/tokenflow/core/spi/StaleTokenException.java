package com.ryuqq.tokenflow.core.spi;

import com.ryuqq.tokenflow.core.model.TokenId;

/**
 * Thrown at commit time when a token row no longer matches the snapshot the
 * writer loaded (another transition committed first).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StaleTokenException extends TokenStoreException {

    private final transient TokenId tokenId;

    public StaleTokenException(TokenId tokenId, String message) {
        super(message);
        this.tokenId = tokenId;
    }

    /**
     * Returns the token whose row changed.
     *
     * @return the token ID
     */
    public TokenId getTokenId() {
        return tokenId;
    }
}
