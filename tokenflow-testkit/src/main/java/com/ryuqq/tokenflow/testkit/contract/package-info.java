/**
 * Contract test infrastructure.
 *
 * <p>Any {@link com.ryuqq.tokenflow.core.spi.TokenStore} implementation paired with the
 * service adapters must satisfy the contract tests built on
 * {@link com.ryuqq.tokenflow.testkit.contract.AbstractContractTest}:</p>
 * <ul>
 *   <li>Atomicity: status write and transition record commit together or not at all</li>
 *   <li>Concurrency: one winner per same-token race, the loser gets Conflict</li>
 *   <li>State transitions: only table edges are applied</li>
 *   <li>Audit trail: one ordered record per successful transition</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tokenflow.testkit.contract;
