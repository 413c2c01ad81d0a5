/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage contract that infrastructure adapters
 * implement for the core library.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.spi.TokenStore} - Token rows and the append-only transition audit trail</li>
 *   <li>{@link com.ryuqq.tokenflow.core.spi.TransactionCallback} - Unit of work committed atomically</li>
 * </ul>
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.spi.TokenStoreException} - Store could not apply or read a change</li>
 *   <li>{@link com.ryuqq.tokenflow.core.spi.StaleTokenException} - Optimistic compare failed at commit time</li>
 *   <li>{@link com.ryuqq.tokenflow.core.spi.DuplicateTokenException} - Token ID already exists</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., tokenflow-adapter-inmemory, a JDBC adapter) provide concrete
 * implementations. Exceptions thrown by implementations are mapped to discriminated
 * results by the service adapter and never cross the public command boundary.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, a relational store for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tokenflow.core.spi;
