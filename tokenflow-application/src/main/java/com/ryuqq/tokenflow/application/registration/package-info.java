/**
 * 토큰 등록 API.
 *
 * <p>{@link com.ryuqq.tokenflow.application.registration.TokenRegistration}은 DRAFT 토큰을 생성하며,
 * 결과는 {@link com.ryuqq.tokenflow.application.registration.RegistrationOutcome}으로 반환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tokenflow.application.registration;
