package com.ryuqq.tokenflow.core.spi;

/**
 * Unit of work executed inside {@link TokenStore#inTransaction(TransactionCallback)}.
 *
 * @param <T> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    /**
     * Executes the unit of work against the store.
     *
     * @param store the store whose writes are buffered in the current transaction
     * @return the result
     */
    T doInTransaction(TokenStore store);
}
