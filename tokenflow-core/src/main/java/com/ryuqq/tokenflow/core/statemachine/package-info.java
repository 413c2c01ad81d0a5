/**
 * Token lifecycle state machine package.
 *
 * <p>This package defines the closed set of token statuses and the transition
 * table every status change must follow.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.statemachine.TokenStatus} - Token lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.tokenflow.core.statemachine.TransitionTable} - Legal next statuses per status</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * DRAFT → UNDER_REVIEW
 * UNDER_REVIEW → APPROVED | REJECTED
 * APPROVED → READY_TO_MINT | REJECTED
 * READY_TO_MINT → MINTED
 * MINTED → DEPLOYED
 * DEPLOYED → PAUSED | DISTRIBUTED
 * PAUSED → DEPLOYED
 *
 * Forbidden:
 * - REJECTED → * (terminal state)
 * - DISTRIBUTED → * (terminal state)
 * - Self transitions and multi-hop jumps (e.g., DRAFT → APPROVED)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Set&lt;TokenStatus&gt; next = TransitionTable.legalNextStates(TokenStatus.APPROVED);
 * // [READY_TO_MINT, REJECTED]
 *
 * boolean legal = TransitionTable.isLegal(TokenStatus.PAUSED, TokenStatus.DEPLOYED); // true
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tokenflow.core.statemachine;
