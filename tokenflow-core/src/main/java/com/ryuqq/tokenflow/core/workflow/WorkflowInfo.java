package com.ryuqq.tokenflow.core.workflow;

import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.util.List;

/**
 * 워크플로우 투영 (파생 값, 저장되지 않음).
 *
 * <p>프레젠테이션 레이어가 렌더링마다 조회하는 현재 상태 표시 정보와
 * 가능한 전이 목록입니다.</p>
 *
 * @param statusCode 상태 코드 (인식할 수 없는 원본 코드 포함)
 * @param statusOrNull 인식된 상태, 인식할 수 없으면 null
 * @param displayName 표시 이름
 * @param description 설명
 * @param availableTransitions 가능한 다음 상태 (정렬됨, 수정 불가)
 * @param canTransition 가능한 전이가 하나 이상이면 true
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowInfo(
    String statusCode,
    TokenStatus statusOrNull,
    String displayName,
    String description,
    List<TokenStatus> availableTransitions,
    boolean canTransition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 표시 필드가 null이거나 canTransition이 전이 목록과 일치하지 않는 경우
     */
    public WorkflowInfo {
        if (displayName == null || description == null) {
            throw new IllegalArgumentException("displayName and description cannot be null");
        }
        availableTransitions = availableTransitions == null ? List.of() : List.copyOf(availableTransitions);
        if (canTransition == availableTransitions.isEmpty()) {
            throw new IllegalArgumentException(
                "canTransition must reflect availableTransitions (canTransition: " + canTransition
                    + ", availableTransitions: " + availableTransitions + ")");
        }
        // statusCode, statusOrNull은 null 허용 (인식할 수 없는 상태)
    }

    /**
     * 상태가 인식되었는지 확인.
     *
     * @return 인식된 상태이면 true
     */
    public boolean isRecognized() {
        return statusOrNull != null;
    }

    /**
     * 인식된 종료 상태인지 확인.
     *
     * @return 종료 상태이면 true
     */
    public boolean isTerminal() {
        return statusOrNull != null && statusOrNull.isTerminal();
    }
}
