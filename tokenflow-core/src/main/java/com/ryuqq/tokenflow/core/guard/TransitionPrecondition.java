package com.ryuqq.tokenflow.core.guard;

import com.ryuqq.tokenflow.core.model.Token;

import java.util.function.Predicate;

/**
 * 호출자가 주입하는 전이 전제조건.
 *
 * <p>전제조건은 대상 상태별로 등록되며 ({@link TransitionPreconditions}),
 * 토큰 스냅샷만 읽는 순수 함수여야 합니다. I/O를 수행해서는 안 됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * TransitionPrecondition hasAddress = TransitionPrecondition.of(
 *     "Token must have a deployment address",
 *     token -&gt; token.attributeOrNull("deploymentAddress") != null);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TransitionPrecondition {

    /**
     * 전제조건 충족 여부.
     *
     * @param token 전이 대상 토큰
     * @return 충족하면 true
     */
    boolean test(Token token);

    /**
     * 불충족 시 거부 사유로 사용되는 설명.
     *
     * @return 설명
     */
    String description();

    /**
     * Predicate로 전제조건 생성.
     *
     * @param description 설명
     * @param predicate 판정 함수
     * @return TransitionPrecondition 인스턴스
     * @throws IllegalArgumentException description이 비어 있거나 predicate가 null인 경우
     */
    static TransitionPrecondition of(String description, Predicate<Token> predicate) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return new TransitionPrecondition() {
            @Override
            public boolean test(Token token) {
                return predicate.test(token);
            }

            @Override
            public String description() {
                return description;
            }

            @Override
            public String toString() {
                return "TransitionPrecondition{" + description + '}';
            }
        };
    }
}
