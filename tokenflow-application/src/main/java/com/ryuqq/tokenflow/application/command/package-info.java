/**
 * Token Lifecycle Application Layer - 상태 변경 커맨드 API.
 *
 * <p>이 패키지는 토큰 상태를 바꾸는 유일한 진입점인 상태 변경 커맨드와
 * 그 결과 타입을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.application.command.StatusUpdateCommand} - 가드와 감사 기록이 적용된 상태 변경</li>
 *   <li>{@link com.ryuqq.tokenflow.application.command.UpdateOutcome} - 성공 또는 실패 (sealed)</li>
 *   <li>{@link com.ryuqq.tokenflow.application.command.UpdateError} - NotFound, IllegalTransition, Conflict, PersistenceFailure</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-service 모듈에 위치</li>
 *   <li><strong>명시적 결과:</strong> 공유 가변 상태 대신 커맨드의 반환값으로 결과 전달</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tokenflow.application.command;
