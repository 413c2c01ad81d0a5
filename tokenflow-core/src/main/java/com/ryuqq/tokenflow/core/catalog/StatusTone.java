package com.ryuqq.tokenflow.core.catalog;

/**
 * 상태 표시 톤.
 *
 * <p>프레젠테이션 레이어는 톤을 아이콘과 색상으로 매핑합니다.
 * 상태별 조건 분기 대신 카탈로그 조회로 결정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StatusTone {

    NEUTRAL,
    PENDING,
    POSITIVE,
    NEGATIVE,
    ACTIVE,
    SUSPENDED,
    FINAL
}
