/**
 * Workflow query package.
 *
 * <p>Read-only projection of a token's status for presentation layers:
 * display fields from the status catalog plus the transitions currently
 * available. Everything here is synchronous and side-effect free.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.workflow.WorkflowQueryService} - describe(token), describe(code), countByStatus</li>
 *   <li>{@link com.ryuqq.tokenflow.core.workflow.WorkflowInfo} - Derived projection (never persisted)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tokenflow.core.workflow;
