/**
 * Application 포트 구현 패키지.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.adapter.service.GuardedStatusUpdateCommand}:
 *       Guard 판정 후 상태 쓰기와 감사 기록을 하나의 트랜잭션으로 커밋</li>
 *   <li>{@link com.ryuqq.tokenflow.adapter.service.DraftTokenRegistrar}: DRAFT 토큰 등록</li>
 *   <li>{@link com.ryuqq.tokenflow.adapter.service.StoreBackedAuditTrailQuery}: 감사 기록 조회</li>
 * </ul>
 *
 * <p>저장소 예외는 결과 타입으로 변환되며 SLF4J로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tokenflow.adapter.service;
