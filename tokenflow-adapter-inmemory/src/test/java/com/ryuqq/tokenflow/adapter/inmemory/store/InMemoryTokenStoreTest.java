package com.ryuqq.tokenflow.adapter.inmemory.store;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.model.TokenStandard;
import com.ryuqq.tokenflow.core.spi.DuplicateTokenException;
import com.ryuqq.tokenflow.core.spi.StaleTokenException;
import com.ryuqq.tokenflow.core.spi.TokenStoreException;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryTokenStore 테스트.
 *
 * <ul>
 *   <li>트랜잭션 안의 쓰기는 커밋 전까지 보이지 않음</li>
 *   <li>콜백 예외 시 아무것도 반영되지 않음</li>
 *   <li>낙관적 비교 실패 시 StaleTokenException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryTokenStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(1);
    private static final Instant T2 = T0.plusSeconds(2);

    private InMemoryTokenStore store;
    private TokenId tokenId;

    @BeforeEach
    void setUp() {
        store = new InMemoryTokenStore();
        tokenId = TokenId.of("TKN-1");
        store.insertToken(Token.draft(tokenId, "Bond A", TokenStandard.ERC1400, T0, null));
    }

    private StatusTransitionRecord record(TokenStatus from, TokenStatus to, Instant at) {
        return new StatusTransitionRecord(tokenId, from, to, null, null, at);
    }

    @Test
    void insertToken_ThenLoad_ReturnsSnapshot() {
        // When
        Token token = store.loadToken(tokenId).orElseThrow();

        // Then
        assertEquals(TokenStatus.DRAFT, token.currentStatus());
        assertTrue(store.loadTransitionHistory(tokenId).isEmpty());
    }

    @Test
    void loadToken_Unknown_ReturnsEmpty() {
        assertTrue(store.loadToken(TokenId.of("TKN-404")).isEmpty());
        assertTrue(store.loadTransitionHistory(TokenId.of("TKN-404")).isEmpty());
    }

    @Test
    void insertToken_DuplicateId_ThrowsException() {
        // When & Then
        DuplicateTokenException exception = assertThrows(
            DuplicateTokenException.class,
            () -> store.insertToken(Token.draft(tokenId, "Other", TokenStandard.ERC20, T1, null))
        );
        assertEquals(tokenId, exception.getTokenId());
        assertEquals("Bond A", store.loadToken(tokenId).orElseThrow().name());
    }

    @Test
    void inTransaction_CommitsStatusAndRecordTogether() {
        // When
        store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
            tx.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T1));
            return null;
        });

        // Then
        Token token = store.loadToken(tokenId).orElseThrow();
        assertEquals(TokenStatus.UNDER_REVIEW, token.currentStatus());
        assertEquals(T1, token.updatedAt());
        assertEquals(1, store.loadTransitionHistory(tokenId).size());
        assertFalse(store.isInTransaction());
    }

    @Test
    void inTransaction_BufferedWritesInvisibleUntilCommit() {
        // When
        TokenStatus seenInside = store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
            return tx.loadToken(tokenId).orElseThrow().currentStatus();
        });

        // Then
        assertEquals(TokenStatus.DRAFT, seenInside);
        assertEquals(TokenStatus.UNDER_REVIEW, store.loadToken(tokenId).orElseThrow().currentStatus());
    }

    @Test
    void inTransaction_CallbackThrows_NothingApplied() {
        // When
        assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
            throw new IllegalStateException("abort");
        }));

        // Then
        assertEquals(TokenStatus.DRAFT, store.loadToken(tokenId).orElseThrow().currentStatus());
        assertTrue(store.loadTransitionHistory(tokenId).isEmpty());
        assertFalse(store.isInTransaction());
    }

    @Test
    void inTransaction_StaleExpectation_ThrowsAndAppliesNothing() {
        // Given: status already moved
        store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
            tx.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T1));
            return null;
        });

        // When: second writer still expects DRAFT
        StaleTokenException exception = assertThrows(StaleTokenException.class, () -> store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T2);
            tx.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T2));
            return null;
        }));

        // Then
        assertEquals(tokenId, exception.getTokenId());
        assertEquals(T1, store.loadToken(tokenId).orElseThrow().updatedAt());
        assertEquals(1, store.loadTransitionHistory(tokenId).size());
    }

    @Test
    void inTransaction_StaleUpdatedAt_ThrowsException() {
        // When & Then: same status, different updatedAt
        assertThrows(StaleTokenException.class, () -> store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0.minusSeconds(5), TokenStatus.UNDER_REVIEW, T1);
            return null;
        }));
    }

    @Test
    void inTransaction_RecordForUnknownToken_ThrowsException() {
        // Given
        TokenId unknown = TokenId.of("TKN-404");

        // When & Then
        assertThrows(TokenStoreException.class, () -> store.inTransaction(tx -> {
            tx.appendTransitionRecord(new StatusTransitionRecord(
                unknown, TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, null, null, T1));
            return null;
        }));
        assertTrue(store.loadTransitionHistory(unknown).isEmpty());
    }

    @Test
    void inTransaction_Nested_JoinsOuterTransaction() {
        // When
        store.inTransaction(outer -> {
            outer.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
            store.inTransaction(inner -> {
                inner.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T1));
                return null;
            });
            assertTrue(store.loadTransitionHistory(tokenId).isEmpty(), "Inner call must not commit on its own");
            return null;
        });

        // Then
        assertEquals(1, store.loadTransitionHistory(tokenId).size());
    }

    @Test
    void writeTokenStatus_OutsideTransaction_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> store.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1)
        );
        assertTrue(exception.getMessage().contains("inTransaction"));
    }

    @Test
    void appendTransitionRecord_OutsideTransaction_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> store.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T1)));
    }

    @Test
    void writeTokenStatus_BackwardsUpdatedAt_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> store.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T1, TokenStatus.UNDER_REVIEW, T0);
            return null;
        }));
    }

    @Test
    void loadTransitionHistory_OrderedByOccurredAt() {
        // Given: records appended out of time order
        store.inTransaction(tx -> {
            tx.appendTransitionRecord(record(TokenStatus.PAUSED, TokenStatus.DEPLOYED, T2));
            tx.appendTransitionRecord(record(TokenStatus.DEPLOYED, TokenStatus.PAUSED, T1));
            return null;
        });

        // When
        List<StatusTransitionRecord> history = store.loadTransitionHistory(tokenId);

        // Then
        assertEquals(T1, history.get(0).occurredAt());
        assertEquals(T2, history.get(1).occurredAt());
        assertThrows(UnsupportedOperationException.class, () -> history.remove(0));
    }

    @Test
    void inTransaction_LockHeldPastTimeout_ThrowsAndAppliesNothing() throws InterruptedException {
        // Given: another thread holds the token's commit lock
        InMemoryTokenStore bounded = new InMemoryTokenStore(new InMemoryTokenStoreConfig().withLockTimeoutMs(50));
        bounded.insertToken(Token.draft(tokenId, "Bond A", TokenStandard.ERC1400, T0, null));
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            ReentrantLock lock = bounded.commitLock(tokenId);
            lock.lock();
            try {
                locked.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock();
            }
        });
        holder.start();
        assertTrue(locked.await(5, TimeUnit.SECONDS));

        try {
            // When
            TokenStoreException exception = assertThrows(TokenStoreException.class, () -> bounded.inTransaction(tx -> {
                tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
                tx.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T1));
                return null;
            }));

            // Then
            assertFalse(exception instanceof StaleTokenException, "Lock timeout is not a conflict");
            assertTrue(exception.getMessage().contains("Timed out after 50ms"), exception.getMessage());
            assertEquals(TokenStatus.DRAFT, bounded.loadToken(tokenId).orElseThrow().currentStatus());
            assertEquals(T0, bounded.loadToken(tokenId).orElseThrow().updatedAt());
            assertTrue(bounded.loadTransitionHistory(tokenId).isEmpty());
            assertFalse(bounded.isInTransaction());
        } finally {
            release.countDown();
            holder.join();
        }

        // And: once released, the same write commits
        bounded.inTransaction(tx -> {
            tx.writeTokenStatus(tokenId, TokenStatus.DRAFT, T0, TokenStatus.UNDER_REVIEW, T1);
            tx.appendTransitionRecord(record(TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW, T1));
            return null;
        });
        assertEquals(TokenStatus.UNDER_REVIEW, bounded.loadToken(tokenId).orElseThrow().currentStatus());
    }

    @Test
    void inTransaction_RoundTripWithinSameInstant_StaleWriterIsAccepted() {
        // Given: DEPLOYED -> PAUSED -> DEPLOYED, all at T1
        TokenId deployedId = TokenId.of("TKN-2");
        store.insertToken(new Token(deployedId, "Bond B", TokenStandard.ERC1400, TokenStatus.DEPLOYED, T0, T1, null));
        store.inTransaction(tx -> {
            tx.writeTokenStatus(deployedId, TokenStatus.DEPLOYED, T1, TokenStatus.PAUSED, T1);
            return null;
        });
        store.inTransaction(tx -> {
            tx.writeTokenStatus(deployedId, TokenStatus.PAUSED, T1, TokenStatus.DEPLOYED, T1);
            return null;
        });

        // When: a writer that loaded (DEPLOYED, T1) before the round trip commits
        store.inTransaction(tx -> {
            tx.writeTokenStatus(deployedId, TokenStatus.DEPLOYED, T1, TokenStatus.DISTRIBUTED, T1);
            return null;
        });

        // Then: the compare covers (status, updatedAt) only
        assertEquals(TokenStatus.DISTRIBUTED, store.loadToken(deployedId).orElseThrow().currentStatus());
    }

    @Test
    void clear_RemovesEverything() {
        // When
        store.clear();

        // Then
        assertTrue(store.loadToken(tokenId).isEmpty());
    }

    @Test
    void constructor_NullConfig_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryTokenStore(null));
    }
}
