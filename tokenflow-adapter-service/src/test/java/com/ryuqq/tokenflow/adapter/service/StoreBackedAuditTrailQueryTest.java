package com.ryuqq.tokenflow.adapter.service;

import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.spi.TokenStore;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * StoreBackedAuditTrailQuery 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StoreBackedAuditTrailQueryTest {

    @Mock
    private TokenStore store;

    @Test
    void history_저장소_기록을_수정_불가_목록으로_반환한다() {
        // given
        TokenId tokenId = TokenId.of("TKN-1");
        List<StatusTransitionRecord> stored = new ArrayList<>();
        stored.add(new StatusTransitionRecord(tokenId, TokenStatus.DRAFT, TokenStatus.UNDER_REVIEW,
            null, null, Instant.parse("2025-01-01T00:00:00Z")));
        when(store.loadTransitionHistory(tokenId)).thenReturn(stored);

        // when
        List<StatusTransitionRecord> history = new StoreBackedAuditTrailQuery(store).history(tokenId);

        // then
        assertThat(history).containsExactlyElementsOf(stored);
        assertThatThrownBy(history::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void history_null_ID는_예외() {
        assertThatThrownBy(() -> new StoreBackedAuditTrailQuery(store).history(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
