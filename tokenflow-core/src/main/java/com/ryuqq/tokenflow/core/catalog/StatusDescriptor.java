package com.ryuqq.tokenflow.core.catalog;

/**
 * 상태 표시 정보.
 *
 * @param displayName 표시 이름 (예: "Ready to Mint")
 * @param description 설명
 * @param tone 표시 톤
 * @param finalStatusWarning 되돌릴 수 없는 최종 상태 경고 표시 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatusDescriptor(
    String displayName,
    String description,
    StatusTone tone,
    boolean finalStatusWarning
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException displayName 또는 description이 비어 있거나 tone이 null인 경우
     */
    public StatusDescriptor {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName cannot be null or blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (tone == null) {
            throw new IllegalArgumentException("tone cannot be null");
        }
    }
}
