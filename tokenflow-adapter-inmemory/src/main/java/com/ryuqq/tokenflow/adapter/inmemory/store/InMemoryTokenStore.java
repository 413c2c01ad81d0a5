package com.ryuqq.tokenflow.adapter.inmemory.store;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.spi.DuplicateTokenException;
import com.ryuqq.tokenflow.core.spi.StaleTokenException;
import com.ryuqq.tokenflow.core.spi.TokenStore;
import com.ryuqq.tokenflow.core.spi.TokenStoreException;
import com.ryuqq.tokenflow.core.spi.TransactionCallback;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link TokenStore} SPI for testing and reference purposes.
 *
 * <p>Each token and its audit trail live in one immutable {@code TokenEntry} that is
 * replaced as a whole on commit, so readers never observe a new status without its
 * transition record (or the reverse).</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;TokenId, TokenEntry&gt; - Committed token snapshot and history (O(1) access)</li>
 *   <li><strong>locks:</strong> ConcurrentHashMap&lt;TokenId, ReentrantLock&gt; - Per-token commit locks</li>
 *   <li><strong>currentTransaction:</strong> ThreadLocal transaction context buffering writes until commit</li>
 * </ul>
 *
 * <p><strong>Commit Algorithm:</strong></p>
 * <pre>
 * 1. Collect touched TokenIds, acquire their locks in TokenId order (bounded wait)
 * 2. Replay buffered writes against a working copy:
 *    - insert: fail with DuplicateTokenException if the ID exists
 *    - status write: fail with StaleTokenException unless status and updatedAt match the expectation
 *    - record append: token must exist
 * 3. Publish every working entry (all validations passed)
 * 4. Release locks
 * </pre>
 *
 * <p><strong>Concurrency Guarantee:</strong></p>
 * <ul>
 *   <li>Commits on the same token are linearized; the loser sees StaleTokenException</li>
 *   <li>Commits on different tokens never contend</li>
 *   <li>Reads are lock-free</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>A transaction touching several tokens publishes them one by one</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TokenStore store = new InMemoryTokenStore();
 * store.insertToken(Token.draft(tokenId, "Bond A", TokenStandard.ERC1400, now, null));
 *
 * store.inTransaction(tx -&gt; {
 *     tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, now, TokenStatus.UNDER_REVIEW, later);
 *     tx.appendTransitionRecord(record);
 *     return null;
 * });
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryTokenStore implements TokenStore {

    /**
     * Committed token snapshots with their audit trails.
     * Key: TokenId, Value: TokenEntry (replaced atomically on commit)
     */
    private final ConcurrentHashMap<TokenId, TokenEntry> entries;

    /**
     * Per-token commit locks, created lazily.
     */
    private final ConcurrentHashMap<TokenId, ReentrantLock> locks;

    /**
     * Transaction context bound to the calling thread.
     */
    private final ThreadLocal<TransactionContext> currentTransaction;

    private final InMemoryTokenStoreConfig config;

    /**
     * Creates a new InMemoryTokenStore with default configuration.
     */
    public InMemoryTokenStore() {
        this(new InMemoryTokenStoreConfig());
    }

    /**
     * Creates a new InMemoryTokenStore.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryTokenStore(InMemoryTokenStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.locks = new ConcurrentHashMap<>();
        this.currentTransaction = new ThreadLocal<>();
        this.config = config;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns the committed snapshot; writes buffered in an open transaction are not visible.</p>
     */
    @Override
    public Optional<Token> loadToken(TokenId tokenId) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        TokenEntry entry = entries.get(tokenId);
        return entry != null ? Optional.of(entry.token) : Optional.empty();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void insertToken(Token token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        TransactionContext context = currentTransaction.get();
        if (context == null) {
            inTransaction(tx -> {
                tx.insertToken(token);
                return null;
            });
            return;
        }
        context.pending.add(new InsertToken(token));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void writeTokenStatus(TokenId tokenId, TokenStatus expectedStatus, Instant expectedUpdatedAt,
                                 TokenStatus newStatus, Instant updatedAt) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (expectedStatus == null || newStatus == null) {
            throw new IllegalArgumentException("States cannot be null (expected: " + expectedStatus + ", new: " + newStatus + ")");
        }
        if (expectedUpdatedAt == null || updatedAt == null) {
            throw new IllegalArgumentException("updatedAt values cannot be null");
        }
        if (updatedAt.isBefore(expectedUpdatedAt)) {
            throw new IllegalArgumentException(
                "updatedAt must be non-decreasing (expected: " + expectedUpdatedAt + ", new: " + updatedAt + ")");
        }
        requireTransaction("writeTokenStatus").pending.add(
            new StatusWrite(tokenId, expectedStatus, expectedUpdatedAt, newStatus, updatedAt));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void appendTransitionRecord(StatusTransitionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        requireTransaction("appendTransitionRecord").pending.add(new RecordAppend(record));
    }

    /**
     * {@inheritDoc}
     *
     * <p>The history is kept in append order and sorted by occurredAt on read
     * (stable sort, so equal timestamps keep append order).</p>
     */
    @Override
    public List<StatusTransitionRecord> loadTransitionHistory(TokenId tokenId) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        TokenEntry entry = entries.get(tokenId);
        if (entry == null) {
            return List.of();
        }
        List<StatusTransitionRecord> ordered = new ArrayList<>(entry.history);
        ordered.sort(Comparator.comparing(StatusTransitionRecord::occurredAt));
        return List.copyOf(ordered);
    }

    /**
     * {@inheritDoc}
     *
     * <p>A nested call joins the transaction already bound to the calling thread.</p>
     */
    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (currentTransaction.get() != null) {
            return callback.doInTransaction(this);
        }

        TransactionContext context = new TransactionContext();
        currentTransaction.set(context);
        try {
            T result = callback.doInTransaction(this);
            commit(context);
            return result;
        } finally {
            currentTransaction.remove();
        }
    }

    /**
     * Checks whether the calling thread has an open transaction.
     *
     * @return true inside {@link #inTransaction(TransactionCallback)}
     */
    public boolean isInTransaction() {
        return currentTransaction.get() != null;
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        entries.clear();
        locks.clear();
    }

    /**
     * Commit lock of a token, created on first use. Exposed for timeout tests.
     */
    ReentrantLock commitLock(TokenId tokenId) {
        return locks.computeIfAbsent(tokenId, ignored -> new ReentrantLock());
    }

    private TransactionContext requireTransaction(String operation) {
        TransactionContext context = currentTransaction.get();
        if (context == null) {
            throw new IllegalStateException(operation + " must be called inside inTransaction()");
        }
        return context;
    }

    private void commit(TransactionContext context) {
        if (context.pending.isEmpty()) {
            return;
        }

        SortedSet<TokenId> touched = new TreeSet<>();
        for (PendingWrite write : context.pending) {
            touched.add(write.tokenId());
        }

        Deque<ReentrantLock> acquired = new ArrayDeque<>();
        try {
            for (TokenId tokenId : touched) {
                ReentrantLock lock = commitLock(tokenId);
                if (!lock.tryLock(config.lockTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    throw new TokenStoreException(
                        "Timed out after " + config.lockTimeoutMs() + "ms waiting for lock on " + tokenId);
                }
                acquired.push(lock);
            }

            Map<TokenId, TokenEntry> working = replay(context.pending);
            entries.putAll(working);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenStoreException("Interrupted while waiting for token lock", e);
        } finally {
            while (!acquired.isEmpty()) {
                acquired.pop().unlock();
            }
        }
    }

    /**
     * Replays buffered writes against the committed state without publishing anything.
     *
     * @return the entries to publish
     * @throws StaleTokenException if an optimistic compare fails
     * @throws DuplicateTokenException if an inserted ID already exists
     * @throws TokenStoreException if a record targets an unknown token
     */
    private Map<TokenId, TokenEntry> replay(List<PendingWrite> pending) {
        Map<TokenId, TokenEntry> working = new HashMap<>();

        for (PendingWrite write : pending) {
            TokenId tokenId = write.tokenId();
            TokenEntry current = working.containsKey(tokenId) ? working.get(tokenId) : entries.get(tokenId);

            if (write instanceof InsertToken insert) {
                if (current != null) {
                    throw new DuplicateTokenException(tokenId);
                }
                working.put(tokenId, new TokenEntry(insert.token, List.of()));

            } else if (write instanceof StatusWrite statusWrite) {
                if (current == null) {
                    throw new StaleTokenException(tokenId, "Token no longer exists: " + tokenId);
                }
                Token token = current.token;
                if (token.currentStatus() != statusWrite.expectedStatus
                        || !token.updatedAt().equals(statusWrite.expectedUpdatedAt)) {
                    throw new StaleTokenException(tokenId, String.format(
                        "Token %s changed since it was loaded (expected %s at %s, found %s at %s)",
                        tokenId.getValue(), statusWrite.expectedStatus, statusWrite.expectedUpdatedAt,
                        token.currentStatus(), token.updatedAt()));
                }
                working.put(tokenId, new TokenEntry(
                    token.withStatus(statusWrite.newStatus, statusWrite.updatedAt), current.history));

            } else if (write instanceof RecordAppend append) {
                if (current == null) {
                    throw new TokenStoreException("Cannot append transition record for unknown token: " + tokenId);
                }
                List<StatusTransitionRecord> history = new ArrayList<>(current.history);
                history.add(append.record);
                working.put(tokenId, new TokenEntry(current.token, List.copyOf(history)));
            }
        }
        return working;
    }

    /**
     * Writes buffered by one transaction, in call order.
     */
    private static final class TransactionContext {
        private final List<PendingWrite> pending = new ArrayList<>();
    }

    private sealed interface PendingWrite permits InsertToken, StatusWrite, RecordAppend {
        TokenId tokenId();
    }

    private record InsertToken(Token token) implements PendingWrite {
        @Override
        public TokenId tokenId() {
            return token.id();
        }
    }

    private record StatusWrite(TokenId tokenId, TokenStatus expectedStatus, Instant expectedUpdatedAt,
                               TokenStatus newStatus, Instant updatedAt) implements PendingWrite {
    }

    private record RecordAppend(StatusTransitionRecord record) implements PendingWrite {
        @Override
        public TokenId tokenId() {
            return record.tokenId();
        }
    }

    /**
     * Committed token snapshot together with its audit trail (append order).
     *
     * @param token the committed token
     * @param history immutable transition records
     */
    private record TokenEntry(Token token, List<StatusTransitionRecord> history) {
    }
}
