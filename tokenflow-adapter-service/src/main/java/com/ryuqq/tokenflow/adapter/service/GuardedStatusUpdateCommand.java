package com.ryuqq.tokenflow.adapter.service;

import com.ryuqq.tokenflow.application.command.Conflict;
import com.ryuqq.tokenflow.application.command.IllegalTransition;
import com.ryuqq.tokenflow.application.command.NotFound;
import com.ryuqq.tokenflow.application.command.PersistenceFailure;
import com.ryuqq.tokenflow.application.command.StatusChanged;
import com.ryuqq.tokenflow.application.command.StatusUpdateCommand;
import com.ryuqq.tokenflow.application.command.UpdateOutcome;
import com.ryuqq.tokenflow.application.command.UpdateStatusRequest;
import com.ryuqq.tokenflow.core.guard.GuardDecision;
import com.ryuqq.tokenflow.core.guard.TransitionGuard;
import com.ryuqq.tokenflow.core.model.StatusTransitionRecord;
import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.model.TokenId;
import com.ryuqq.tokenflow.core.spi.StaleTokenException;
import com.ryuqq.tokenflow.core.spi.TokenStore;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * TransitionGuard와 TokenStore를 조합한 상태 변경 명령 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. loadToken(tokenId)
 *    - 없음 → NotFound
 *    - 조회 실패 → PersistenceFailure
 * 2. guard.canTransition(token, toStatus)
 *    - Denied → IllegalTransition(kind, reason)
 * 3. inTransaction:
 *    a. writeTokenStatus(expected = 조회한 status/updatedAt)
 *    b. appendTransitionRecord(record)
 * 4. StaleTokenException → Conflict
 *    기타 저장 실패 → PersistenceFailure
 * 5. 성공 → StatusChanged
 * </pre>
 *
 * <p><strong>시각 규칙:</strong></p>
 * <ul>
 *   <li>새 updatedAt = max(clock.instant(), 기존 updatedAt)</li>
 *   <li>감사 기록의 occurredAt은 새 updatedAt과 동일</li>
 * </ul>
 *
 * <p>런타임 저장소 오류는 예외로 전파하지 않고 {@link UpdateOutcome}으로 변환합니다.
 * 요청이 null인 경우만 IllegalArgumentException을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GuardedStatusUpdateCommand implements StatusUpdateCommand {

    private static final Logger log = LoggerFactory.getLogger(GuardedStatusUpdateCommand.class);

    private final TokenStore store;
    private final TransitionGuard guard;
    private final Clock clock;

    /**
     * 기본 Guard(전제조건 없음)와 UTC 시계를 사용하는 생성자.
     *
     * @param store 저장소
     */
    public GuardedStatusUpdateCommand(TokenStore store) {
        this(store, new TransitionGuard());
    }

    /**
     * UTC 시계를 사용하는 생성자.
     *
     * @param store 저장소
     * @param guard 전이 Guard
     */
    public GuardedStatusUpdateCommand(TokenStore store, TransitionGuard guard) {
        this(store, guard, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param guard 전이 Guard
     * @param clock 시각 공급자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GuardedStatusUpdateCommand(TokenStore store, TransitionGuard guard, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.guard = guard;
        this.clock = clock;
    }

    @Override
    public UpdateOutcome updateStatus(UpdateStatusRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        TokenId tokenId = request.tokenId();
        TokenStatus toStatus = request.toStatus();

        // 1. 토큰 조회
        Optional<Token> loaded;
        try {
            loaded = store.loadToken(tokenId);
        } catch (RuntimeException e) {
            log.error("Failed to load token {}", tokenId, e);
            return new PersistenceFailure(tokenId, "Failed to load token");
        }
        if (loaded.isEmpty()) {
            log.debug("Status update rejected, token not found: {}", tokenId);
            return new NotFound(tokenId);
        }
        Token token = loaded.get();
        TokenStatus fromStatus = token.currentStatus();

        // 2. Guard 판정
        GuardDecision decision = guard.canTransition(token, toStatus);
        if (decision instanceof GuardDecision.Denied denied) {
            log.debug("Status update denied for {}: {} ({})", tokenId, denied.reason(), denied.kind());
            return new IllegalTransition(tokenId, fromStatus, toStatus, denied.kind(), denied.reason());
        }

        // 3. 상태 쓰기 + 감사 기록을 하나의 트랜잭션으로
        Instant now = clock.instant();
        Instant updatedAt = now.isBefore(token.updatedAt()) ? token.updatedAt() : now;
        StatusTransitionRecord record = new StatusTransitionRecord(
            tokenId, fromStatus, toStatus, request.actorIdOrNull(), request.notesOrNull(), updatedAt);

        try {
            store.inTransaction(tx -> {
                tx.writeTokenStatus(tokenId, fromStatus, token.updatedAt(), toStatus, updatedAt);
                tx.appendTransitionRecord(record);
                return null;
            });
        } catch (StaleTokenException e) {
            log.warn("Concurrent modification on {} while moving {} → {}: {}",
                tokenId, fromStatus, toStatus, e.getMessage());
            return new Conflict(tokenId, fromStatus, toStatus);
        } catch (RuntimeException e) {
            log.error("Failed to persist status transition for {}: {} → {}", tokenId, fromStatus, toStatus, e);
            return new PersistenceFailure(tokenId, "Failed to persist status transition");
        }

        log.info("Token {} status changed: {} → {}", tokenId, fromStatus, toStatus);
        return new StatusChanged(tokenId, fromStatus, toStatus, record);
    }
}
