/**
 * Core domain model package containing value objects and immutable snapshots.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.model.TokenId} - Token unique identifier</li>
 *   <li>{@link com.ryuqq.tokenflow.core.model.TokenStandard} - The six token standards (ERC-20 ... ERC-4626)</li>
 * </ul>
 *
 * <h2>Snapshots and Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.model.Token} - Token state as loaded from the store</li>
 *   <li>{@link com.ryuqq.tokenflow.core.model.StatusTransitionRecord} - Append-only audit entry for one executed transition</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are immutable; a status change produces a new snapshot</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Opaque attributes:</strong> Standard-specific properties are carried, never interpreted</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tokenflow.core.model;
