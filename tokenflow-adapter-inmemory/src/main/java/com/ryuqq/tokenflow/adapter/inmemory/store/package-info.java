/**
 * In-memory TokenStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the TokenStore SPI
 * for tests and local development.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.adapter.inmemory.store.InMemoryTokenStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.tokenflow.core.spi.TokenStore}</li>
 *   <li>{@link com.ryuqq.tokenflow.adapter.inmemory.store.InMemoryTokenStoreConfig}:
 *       Lock wait configuration</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> {@link java.util.concurrent.ConcurrentHashMap} for committed
 *       entries and per-token {@link java.util.concurrent.locks.ReentrantLock}s for commits</li>
 *   <li><strong>Transaction Simulation:</strong> ThreadLocal-based transaction context buffering writes</li>
 *   <li><strong>Optimistic Concurrency:</strong> status writes compare status and updatedAt at commit time</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.tokenflow.core.spi.TokenStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tokenflow.adapter.inmemory.store;
