package com.ryuqq.tokenflow.core.spi;

/**
 * Base exception for {@link TokenStore} failures.
 *
 * <p>Thrown when the store cannot durably apply or read a change. When thrown
 * from a transaction, no partial write is observable.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TokenStoreException extends RuntimeException {

    public TokenStoreException(String message) {
        super(message);
    }

    public TokenStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
