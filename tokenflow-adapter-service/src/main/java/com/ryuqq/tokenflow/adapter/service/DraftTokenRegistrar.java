package com.ryuqq.tokenflow.adapter.service;

import com.ryuqq.tokenflow.application.registration.RegistrationOutcome;
import com.ryuqq.tokenflow.application.registration.TokenRegistration;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.model.TokenStandard;
import com.ryuqq.tokenflow.core.spi.DuplicateTokenException;
import com.ryuqq.tokenflow.core.spi.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * DRAFT 토큰 등록 구현체.
 *
 * <p>신규 토큰은 항상 DRAFT 상태이며 createdAt과 updatedAt이 같습니다.
 * 등록 시점에는 감사 기록을 남기지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DraftTokenRegistrar implements TokenRegistration {

    private static final Logger log = LoggerFactory.getLogger(DraftTokenRegistrar.class);

    private final TokenStore store;
    private final Clock clock;

    /**
     * UTC 시계를 사용하는 생성자.
     *
     * @param store 저장소
     */
    public DraftTokenRegistrar(TokenStore store) {
        this(store, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param clock 시각 공급자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DraftTokenRegistrar(TokenStore store, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException tokenId, name, standard가 유효하지 않은 경우
     */
    @Override
    public RegistrationOutcome registerDraft(TokenId tokenId, String name, TokenStandard standard,
                                             Map<String, String> attributes) {
        Token token = Token.draft(tokenId, name, standard, clock.instant(), attributes);

        try {
            store.insertToken(token);
        } catch (DuplicateTokenException e) {
            log.warn("Token already registered: {}", tokenId);
            return new RegistrationOutcome.AlreadyExists(tokenId);
        } catch (RuntimeException e) {
            log.error("Failed to register token {}", tokenId, e);
            return new RegistrationOutcome.RegistrationFailed(tokenId, "Failed to persist token");
        }

        log.info("Token {} registered as {} ({})", tokenId, token.currentStatus(), standard.code());
        return new RegistrationOutcome.Registered(token);
    }
}
