/**
 * 감사 기록 조회 API.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tokenflow.application.audit;
