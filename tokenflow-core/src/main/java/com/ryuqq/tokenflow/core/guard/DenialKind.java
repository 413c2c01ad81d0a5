package com.ryuqq.tokenflow.core.guard;

/**
 * 전이 거부 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DenialKind {

    /**
     * 전이표에 없는 전이 (종료 상태에서의 전이, 다단계 점프 포함).
     */
    ILLEGAL_TRANSITION,

    /**
     * 현재 상태와 같은 상태로의 전이.
     */
    NO_OP_TRANSITION,

    /**
     * 호출자가 주입한 전제조건 불충족.
     */
    PRECONDITION_FAILED
}
