package com.ryuqq.tokenflow.application.registration;

import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;

/**
 * 토큰 등록 결과.
 *
 * <ul>
 *   <li>{@link Registered}: DRAFT 토큰 생성됨</li>
 *   <li>{@link AlreadyExists}: 같은 ID의 토큰이 이미 존재</li>
 *   <li>{@link RegistrationFailed}: 저장소 실패</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface RegistrationOutcome
    permits RegistrationOutcome.Registered, RegistrationOutcome.AlreadyExists, RegistrationOutcome.RegistrationFailed {

    /**
     * 등록 성공 여부.
     *
     * @return 성공이면 true
     */
    default boolean isRegistered() {
        return this instanceof Registered;
    }

    /**
     * DRAFT 토큰 생성됨.
     *
     * @param token 생성된 토큰
     */
    record Registered(Token token) implements RegistrationOutcome {

        public Registered {
            if (token == null) {
                throw new IllegalArgumentException("token cannot be null");
            }
        }
    }

    /**
     * 같은 ID의 토큰이 이미 존재.
     *
     * @param tokenId 중복된 토큰 ID
     */
    record AlreadyExists(TokenId tokenId) implements RegistrationOutcome {

        public AlreadyExists {
            if (tokenId == null) {
                throw new IllegalArgumentException("tokenId cannot be null");
            }
        }
    }

    /**
     * 저장소 실패 (토큰이 생성되지 않음).
     *
     * @param tokenId 토큰 ID
     * @param reason 실패 사유
     */
    record RegistrationFailed(TokenId tokenId, String reason) implements RegistrationOutcome {

        public RegistrationFailed {
            if (tokenId == null) {
                throw new IllegalArgumentException("tokenId cannot be null");
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
