package com.ryuqq.tokenflow.application.command;

import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

/**
 * 동시 전이 경합에서 패배.
 *
 * <p>토큰을 로드한 이후 다른 전이가 먼저 커밋되었습니다.
 * 감사 기록은 추가되지 않았으며, 호출자는 재조회 후 다시 시도해야 합니다.</p>
 *
 * @param tokenId 토큰 ID
 * @param expectedStatus 로드 시점의 상태
 * @param requestedStatus 요청된 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Conflict(
    TokenId tokenId,
    TokenStatus expectedStatus,
    TokenStatus requestedStatus
) implements UpdateError {

    public Conflict {
        if (tokenId == null || expectedStatus == null || requestedStatus == null) {
            throw new IllegalArgumentException("Conflict fields cannot be null");
        }
    }

    @Override
    public String message() {
        return String.format("Token %s changed after it was loaded as %s; reload and retry %s",
            tokenId.getValue(), expectedStatus, requestedStatus);
    }
}
