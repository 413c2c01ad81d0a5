/**
 * Transition guard package.
 *
 * <p>Validates a requested status change against the transition table and
 * caller-supplied, pure, status-keyed preconditions. The guard never throws;
 * every check returns a {@link com.ryuqq.tokenflow.core.guard.GuardDecision}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.guard.TransitionGuard} - Ordered checks: no-op, table membership, preconditions</li>
 *   <li>{@link com.ryuqq.tokenflow.core.guard.GuardDecision} - Sealed result (Allowed, Denied)</li>
 *   <li>{@link com.ryuqq.tokenflow.core.guard.DenialKind} - ILLEGAL_TRANSITION, NO_OP_TRANSITION, PRECONDITION_FAILED</li>
 *   <li>{@link com.ryuqq.tokenflow.core.guard.TransitionPrecondition} - Injected predicate on a token snapshot</li>
 *   <li>{@link com.ryuqq.tokenflow.core.guard.TransitionPreconditions} - Immutable registry keyed by target status</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tokenflow.core.guard;
