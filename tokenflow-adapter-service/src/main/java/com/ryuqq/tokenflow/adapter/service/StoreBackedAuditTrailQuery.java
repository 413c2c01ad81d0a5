package com.ryuqq.tokenflow.adapter.service;

import com.ryuqq.tokenflow.application.audit.AuditTrailQuery;
import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.spi.TokenStore;

import java.util.List;

/**
 * TokenStore 기반 감사 기록 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StoreBackedAuditTrailQuery implements AuditTrailQuery {

    private final TokenStore store;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public StoreBackedAuditTrailQuery(TokenStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public List<StatusTransitionRecord> history(TokenId tokenId) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        return List.copyOf(store.loadTransitionHistory(tokenId));
    }
}
