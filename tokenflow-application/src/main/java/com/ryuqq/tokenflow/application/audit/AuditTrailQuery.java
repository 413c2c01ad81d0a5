package com.ryuqq.tokenflow.application.audit;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.TokenId;

import java.util.List;

/**
 * 토큰 상태 전이 감사 기록 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AuditTrailQuery {

    /**
     * 토큰의 전이 기록 조회 (occurredAt 오름차순, 동일 시각은 추가 순서).
     *
     * @param tokenId 토큰 ID
     * @return 전이 기록 (수정 불가, 알 수 없는 토큰이면 빈 목록)
     * @throws IllegalArgumentException tokenId가 null인 경우
     */
    List<StatusTransitionRecord> history(TokenId tokenId);
}
