package com.ryuqq.tokenflow.core.guard;

import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 대상 상태별 전제조건 레지스트리 (불변).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionPreconditions preconditions = TransitionPreconditions.builder()
 *     .require(TokenStatus.DEPLOYED, hasDeploymentAddress)
 *     .require(TokenStatus.DISTRIBUTED, hasAllocations)
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionPreconditions {

    private static final TransitionPreconditions NONE = new TransitionPreconditions(new EnumMap<>(TokenStatus.class));

    private final Map<TokenStatus, List<TransitionPrecondition>> byTarget;

    private TransitionPreconditions(Map<TokenStatus, List<TransitionPrecondition>> byTarget) {
        Map<TokenStatus, List<TransitionPrecondition>> copy = new EnumMap<>(TokenStatus.class);
        byTarget.forEach((status, list) -> copy.put(status, List.copyOf(list)));
        this.byTarget = Collections.unmodifiableMap(copy);
    }

    /**
     * 전제조건이 없는 레지스트리.
     *
     * @return 빈 레지스트리
     */
    public static TransitionPreconditions none() {
        return NONE;
    }

    /**
     * 빌더 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 대상 상태에 등록된 전제조건 조회 (등록 순서).
     *
     * @param target 대상 상태
     * @return 전제조건 목록 (비어 있을 수 있음)
     */
    public List<TransitionPrecondition> forTarget(TokenStatus target) {
        return byTarget.getOrDefault(target, List.of());
    }

    /**
     * TransitionPreconditions 빌더.
     */
    public static final class Builder {

        private final Map<TokenStatus, List<TransitionPrecondition>> byTarget = new EnumMap<>(TokenStatus.class);

        private Builder() {
        }

        /**
         * 대상 상태에 전제조건 추가.
         *
         * @param target 대상 상태
         * @param precondition 전제조건
         * @return this
         * @throws IllegalArgumentException 인자가 null인 경우
         */
        public Builder require(TokenStatus target, TransitionPrecondition precondition) {
            if (target == null) {
                throw new IllegalArgumentException("target cannot be null");
            }
            if (precondition == null) {
                throw new IllegalArgumentException("precondition cannot be null");
            }
            byTarget.computeIfAbsent(target, ignored -> new ArrayList<>()).add(precondition);
            return this;
        }

        /**
         * 불변 레지스트리 생성.
         *
         * @return TransitionPreconditions
         */
        public TransitionPreconditions build() {
            return new TransitionPreconditions(byTarget);
        }
    }
}
