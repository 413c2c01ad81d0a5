package com.ryuqq.tokenflow.core.guard;

import com.ryuqq.tokenflow.core.model.Token;
import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import com.ryuqq.tokenflow.core.statemachine.TransitionTable;

/**
 * 상태 전이 가드.
 *
 * <p>요청된 (현재 상태 → 대상 상태) 전이를 전이표와 주입된 전제조건으로 검증합니다.
 * 예외를 던지지 않으며 항상 {@link GuardDecision}을 반환합니다.</p>
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>대상 상태 == 현재 상태 → {@link DenialKind#NO_OP_TRANSITION}</li>
 *   <li>대상 상태 ∉ legalNextStates(현재 상태) → {@link DenialKind#ILLEGAL_TRANSITION}</li>
 *   <li>대상 상태에 등록된 전제조건 중 하나라도 불충족 → {@link DenialKind#PRECONDITION_FAILED}</li>
 * </ol>
 *
 * <p>가드는 불변이며 동기화 없이 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionGuard {

    private final TransitionPreconditions preconditions;

    /**
     * 전제조건 없는 가드 생성.
     */
    public TransitionGuard() {
        this(TransitionPreconditions.none());
    }

    /**
     * 생성자.
     *
     * @param preconditions 대상 상태별 전제조건
     * @throws IllegalArgumentException preconditions가 null인 경우
     */
    public TransitionGuard(TransitionPreconditions preconditions) {
        if (preconditions == null) {
            throw new IllegalArgumentException("preconditions cannot be null");
        }
        this.preconditions = preconditions;
    }

    /**
     * 전이 가능 여부 판정.
     *
     * @param token 전이 대상 토큰
     * @param to 대상 상태
     * @return 판정 결과 (non-null)
     */
    public GuardDecision canTransition(Token token, TokenStatus to) {
        if (token == null || to == null) {
            return GuardDecision.denied(DenialKind.ILLEGAL_TRANSITION,
                "Token and target status are required (token: " + token + ", to: " + to + ")");
        }

        TokenStatus from = token.currentStatus();

        if (from == to) {
            return GuardDecision.denied(DenialKind.NO_OP_TRANSITION,
                String.format("Token %s is already %s", token.id().getValue(), from));
        }

        if (!TransitionTable.isLegal(from, to)) {
            String reason = from.isTerminal()
                ? String.format("Cannot transition from terminal status: %s → %s", from, to)
                : String.format("Invalid status transition: %s → %s (allowed: %s)",
                    from, to, TransitionTable.legalNextStates(from));
            return GuardDecision.denied(DenialKind.ILLEGAL_TRANSITION, reason);
        }

        return checkPreconditions(token, to);
    }

    /**
     * 대상 상태에 등록된 전제조건만 검사.
     *
     * <p>전이표 검사를 이미 통과한 후보를 걸러낼 때 사용합니다.</p>
     *
     * @param token 토큰
     * @param to 대상 상태
     * @return 판정 결과
     */
    public GuardDecision checkPreconditions(Token token, TokenStatus to) {
        for (TransitionPrecondition precondition : preconditions.forTarget(to)) {
            boolean satisfied;
            try {
                satisfied = precondition.test(token);
            } catch (RuntimeException e) {
                return GuardDecision.denied(DenialKind.PRECONDITION_FAILED,
                    describe(precondition, to) + " (precondition error: " + e.getClass().getSimpleName() + ")");
            }
            if (!satisfied) {
                return GuardDecision.denied(DenialKind.PRECONDITION_FAILED, describe(precondition, to));
            }
        }
        return GuardDecision.allowed();
    }

    /**
     * 거부 사유로 쓸 전제조건 설명.
     *
     * <p>설명이 null, 공백이거나 조회 중 예외가 발생하면 고정 문구로 대체합니다.</p>
     */
    private static String describe(TransitionPrecondition precondition, TokenStatus to) {
        String fallback = "Precondition for " + to + " not satisfied";
        try {
            String description = precondition.description();
            return description == null || description.isBlank() ? fallback : description;
        } catch (RuntimeException e) {
            return fallback;
        }
    }
}
