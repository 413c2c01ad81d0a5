package com.ryuqq.tokenflow.application.registration;

import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.model.TokenStandard;

import java.util.Map;

/**
 * 신규 토큰 등록.
 *
 * <p>모든 토큰은 DRAFT 상태로 생성됩니다. 생성 시점에는 상태 전이가 없으므로
 * 감사 기록을 추가하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TokenRegistration {

    /**
     * DRAFT 토큰 등록.
     *
     * @param tokenId 토큰 ID
     * @param name 토큰 이름
     * @param standard 토큰 표준
     * @param attributes 불투명 속성 (null 허용)
     * @return 등록 결과 (non-null)
     * @throws IllegalArgumentException tokenId, name, standard가 유효하지 않은 경우
     */
    RegistrationOutcome registerDraft(TokenId tokenId, String name, TokenStandard standard, Map<String, String> attributes);
}
