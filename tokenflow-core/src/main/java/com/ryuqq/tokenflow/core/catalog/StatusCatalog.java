package com.ryuqq.tokenflow.core.catalog;

import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 상태 카탈로그.
 *
 * <p>모든 {@link TokenStatus}에 대한 표시 이름, 설명, 톤을 담은 정적 테이블입니다.
 * 인식할 수 없는 상태 코드에는 {@link #fallback()} 항목을 반환하므로
 * 호출자는 항상 정의된 표시 정보를 받습니다.</p>
 *
 * <p><strong>주의:</strong> fallback은 표시 전용이며 전이 허용 여부에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusCatalog {

    private static final StatusDescriptor UNKNOWN = new StatusDescriptor(
        "Unknown",
        "Status is not recognized; no transitions are available",
        StatusTone.NEUTRAL,
        false
    );

    private static final Map<TokenStatus, StatusDescriptor> ENTRIES = buildEntries();

    // Utility class - prevent instantiation
    private StatusCatalog() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static Map<TokenStatus, StatusDescriptor> buildEntries() {
        Map<TokenStatus, StatusDescriptor> entries = new EnumMap<>(TokenStatus.class);
        for (TokenStatus status : TokenStatus.values()) {
            StatusDescriptor descriptor = switch (status) {
                case DRAFT -> new StatusDescriptor("Draft",
                    "Token configuration is being authored", StatusTone.NEUTRAL, false);
                case UNDER_REVIEW -> new StatusDescriptor("Under Review",
                    "Token configuration is awaiting approval", StatusTone.PENDING, false);
                case APPROVED -> new StatusDescriptor("Approved",
                    "Token configuration has been approved", StatusTone.POSITIVE, false);
                case REJECTED -> new StatusDescriptor("Rejected",
                    "Token configuration was rejected during review", StatusTone.NEGATIVE, false);
                case READY_TO_MINT -> new StatusDescriptor("Ready to Mint",
                    "Token is approved and prepared for minting", StatusTone.PENDING, false);
                case MINTED -> new StatusDescriptor("Minted",
                    "Token has been minted", StatusTone.POSITIVE, false);
                case DEPLOYED -> new StatusDescriptor("Deployed",
                    "Token contract is deployed and active", StatusTone.ACTIVE, false);
                case PAUSED -> new StatusDescriptor("Paused",
                    "Token operations are temporarily suspended", StatusTone.SUSPENDED, false);
                case DISTRIBUTED -> new StatusDescriptor("Distributed",
                    "Token has been distributed to investors; this is a final status", StatusTone.FINAL, true);
            };
            entries.put(status, descriptor);
        }
        return Collections.unmodifiableMap(entries);
    }

    /**
     * 상태 표시 정보 조회.
     *
     * @param status 상태 (null이면 fallback)
     * @return 표시 정보 (non-null)
     */
    public static StatusDescriptor describe(TokenStatus status) {
        if (status == null) {
            return UNKNOWN;
        }
        return ENTRIES.get(status);
    }

    /**
     * 상태 코드의 표시 정보 조회.
     *
     * @param code 저장소 상태 코드 또는 별칭 (null 허용)
     * @return 표시 정보, 인식할 수 없는 코드면 fallback
     */
    public static StatusDescriptor describe(String code) {
        return TokenStatus.fromCode(code)
            .map(StatusCatalog::describe)
            .orElse(UNKNOWN);
    }

    /**
     * 전체 카탈로그 조회 (enum 선언 순서).
     *
     * <p>상태 선택 UI 구성에 사용합니다.</p>
     *
     * @return 상태 → 표시 정보 맵 (수정 불가)
     */
    public static Map<TokenStatus, StatusDescriptor> entries() {
        return ENTRIES;
    }

    /**
     * 인식할 수 없는 상태용 표시 정보.
     *
     * @return fallback 표시 정보
     */
    public static StatusDescriptor fallback() {
        return UNKNOWN;
    }
}
