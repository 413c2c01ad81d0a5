package com.ryuqq.tokenflow.testkit.contract;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.spi.StaleTokenException;
import com.ryuqq.tokenflow.core.spi.TokenStore;
import com.ryuqq.tokenflow.core.spi.TokenStoreException;
import com.ryuqq.tokenflow.core.spi.TransactionCallback;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * TokenStore decorator that injects failures for contract tests.
 *
 * <p>Transactions are delegated to the wrapped store with this decorator passed to the
 * callback, so every write issued inside a transaction goes through the fault checks
 * and still lands in the delegate's open transaction.</p>
 *
 * <p><strong>Fault Points:</strong></p>
 * <ul>
 *   <li>load: {@link #failOnLoad(boolean)}, plus a hook run after each successful load</li>
 *   <li>status write: {@link #failOnStatusWrite(boolean)}</li>
 *   <li>record append: {@link #failOnRecordAppend(boolean)}</li>
 *   <li>commit: {@link #failBeforeCommit(boolean)} aborts after the callback ran,
 *       {@link #conflictOnCommit(boolean)} reports a lost optimistic compare</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FaultInjectingTokenStore implements TokenStore {

    private final TokenStore delegate;

    private volatile boolean failOnLoad;
    private volatile boolean failOnStatusWrite;
    private volatile boolean failOnRecordAppend;
    private volatile boolean failBeforeCommit;
    private volatile boolean conflictOnCommit;
    private volatile Consumer<TokenId> loadHook;
    private volatile TokenId lastStatusWriteOrNull;

    private final AtomicInteger committedTransactions = new AtomicInteger();

    /**
     * Creates a decorator with every fault disabled.
     *
     * @param delegate the store receiving the calls
     * @throws IllegalArgumentException if delegate is null
     */
    public FaultInjectingTokenStore(TokenStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public void failOnLoad(boolean enabled) {
        this.failOnLoad = enabled;
    }

    public void failOnStatusWrite(boolean enabled) {
        this.failOnStatusWrite = enabled;
    }

    public void failOnRecordAppend(boolean enabled) {
        this.failOnRecordAppend = enabled;
    }

    public void failBeforeCommit(boolean enabled) {
        this.failBeforeCommit = enabled;
    }

    public void conflictOnCommit(boolean enabled) {
        this.conflictOnCommit = enabled;
    }

    /**
     * Installs a hook invoked with the token ID after every successful load.
     *
     * <p>Used as a rendezvous point to make concurrent writers read the same snapshot.</p>
     *
     * @param hook the hook, or null to remove it
     */
    public void setLoadHook(Consumer<TokenId> hook) {
        this.loadHook = hook;
    }

    /**
     * Disables every fault and removes the load hook.
     */
    public void reset() {
        failOnLoad = false;
        failOnStatusWrite = false;
        failOnRecordAppend = false;
        failBeforeCommit = false;
        conflictOnCommit = false;
        loadHook = null;
    }

    /**
     * @return number of transactions that reached the delegate's commit
     */
    public int committedTransactions() {
        return committedTransactions.get();
    }

    @Override
    public Optional<Token> loadToken(TokenId tokenId) {
        if (failOnLoad) {
            throw new TokenStoreException("Injected load failure for " + tokenId);
        }
        Optional<Token> token = delegate.loadToken(tokenId);
        Consumer<TokenId> hook = loadHook;
        if (hook != null) {
            hook.accept(tokenId);
        }
        return token;
    }

    @Override
    public void insertToken(Token token) {
        delegate.insertToken(token);
    }

    @Override
    public void writeTokenStatus(TokenId tokenId, TokenStatus expectedStatus, Instant expectedUpdatedAt,
                                 TokenStatus newStatus, Instant updatedAt) {
        if (failOnStatusWrite) {
            throw new TokenStoreException("Injected status write failure for " + tokenId);
        }
        lastStatusWriteOrNull = tokenId;
        delegate.writeTokenStatus(tokenId, expectedStatus, expectedUpdatedAt, newStatus, updatedAt);
    }

    @Override
    public void appendTransitionRecord(StatusTransitionRecord record) {
        if (failOnRecordAppend) {
            throw new TokenStoreException("Injected record append failure for " + record.tokenId());
        }
        delegate.appendTransitionRecord(record);
    }

    @Override
    public List<StatusTransitionRecord> loadTransitionHistory(TokenId tokenId) {
        return delegate.loadTransitionHistory(tokenId);
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        T result = delegate.inTransaction(tx -> {
            T value = callback.doInTransaction(this);
            if (failBeforeCommit) {
                throw new TokenStoreException("Injected failure before commit");
            }
            if (conflictOnCommit) {
                throw new StaleTokenException(lastStatusWriteOrNull, "Injected optimistic compare failure");
            }
            return value;
        });
        committedTransactions.incrementAndGet();
        return result;
    }
}
