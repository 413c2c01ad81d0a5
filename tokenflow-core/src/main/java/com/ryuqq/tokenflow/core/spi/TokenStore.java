package com.ryuqq.tokenflow.core.spi;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for token status and the transition audit trail.
 *
 * <p>The store is an opaque collaborator: it owns the token rows and the
 * append-only audit log. This interface fixes the write contract the status
 * update command relies on.</p>
 *
 * <p><strong>Transaction Boundary:</strong></p>
 * <pre>
 * BEGIN TRANSACTION;
 *   UPDATE tokens SET status = ?, updated_at = ?
 *    WHERE id = ? AND status = ? AND updated_at = ?;   -- optimistic compare
 *   INSERT INTO token_status_history (token_id, from_status, to_status, actor_id, notes, occurred_at)
 *   VALUES (?, ?, ?, ?, ?, ?);
 * COMMIT;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: writes issued inside {@link #inTransaction(TransactionCallback)} commit together or not at all</li>
 *   <li>Linearizability: concurrent commits against the same token are serialized;
 *       the loser of a race fails with {@link StaleTokenException}</li>
 *   <li>Append-only: transition records are never updated or deleted</li>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Independence: commits against different tokens require no coordination</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TokenStore {

    /**
     * Loads the committed snapshot of a token.
     *
     * @param tokenId the token ID
     * @return the token, or empty if no token exists for the ID
     * @throws IllegalArgumentException if tokenId is null
     * @throws TokenStoreException if the store cannot be read
     */
    Optional<Token> loadToken(TokenId tokenId);

    /**
     * Inserts a new token row.
     *
     * <p>May be called inside or outside a transaction. Outside a transaction
     * the insert commits immediately.</p>
     *
     * @param token the token to insert
     * @throws IllegalArgumentException if token is null
     * @throws DuplicateTokenException if a token with the same ID already exists
     * @throws TokenStoreException if the insert cannot be applied
     */
    void insertToken(Token token);

    /**
     * Writes a new status for a token, guarded by an optimistic compare.
     *
     * <p>Must be called inside {@link #inTransaction(TransactionCallback)}. The
     * expected values are compared against the committed row at commit time; a
     * mismatch aborts the whole transaction with {@link StaleTokenException}.</p>
     *
     * <p>The compare covers the (status, updatedAt) pair only, with no row version.
     * If the clock does not advance between commits (a fixed or coarse clock), a
     * round trip such as DEPLOYED → PAUSED → DEPLOYED can restore the exact pair a
     * stale writer loaded, and that writer's commit is then accepted. Every record
     * written this way is still a legal edge of the transition table.</p>
     *
     * @param tokenId the token ID
     * @param expectedStatus the status the caller loaded
     * @param expectedUpdatedAt the updatedAt the caller loaded
     * @param newStatus the status to write
     * @param updatedAt the refreshed updatedAt (not before expectedUpdatedAt)
     * @throws IllegalArgumentException if any argument is null or updatedAt moves backwards
     * @throws IllegalStateException if called outside a transaction
     */
    void writeTokenStatus(TokenId tokenId, TokenStatus expectedStatus, Instant expectedUpdatedAt,
                          TokenStatus newStatus, Instant updatedAt);

    /**
     * Appends one record to the audit trail.
     *
     * <p>Must be called inside {@link #inTransaction(TransactionCallback)}; the
     * record becomes visible only when the transaction commits.</p>
     *
     * @param record the transition record
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if called outside a transaction
     */
    void appendTransitionRecord(StatusTransitionRecord record);

    /**
     * Loads the committed audit trail of a token, ordered by occurredAt (ties in append order).
     *
     * @param tokenId the token ID
     * @return unmodifiable list of records (empty for unknown tokens)
     * @throws IllegalArgumentException if tokenId is null
     * @throws TokenStoreException if the store cannot be read
     */
    List<StatusTransitionRecord> loadTransitionHistory(TokenId tokenId);

    /**
     * Runs the callback in one transaction.
     *
     * <p>If the callback returns normally, all buffered writes are committed
     * atomically. If the callback throws, or the commit fails, nothing is
     * observable and the exception propagates to the caller.</p>
     *
     * @param callback the unit of work
     * @param <T> callback result type
     * @return the callback result
     * @throws StaleTokenException if an optimistic compare fails at commit time
     * @throws TokenStoreException if the commit cannot be applied
     */
    <T> T inTransaction(TransactionCallback<T> callback);
}
