package com.ryuqq.tokenflow.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 토큰 표준 (6개의 병렬 스키마).
 *
 * <p>표준별 속성 스키마는 이 라이브러리가 해석하지 않으며,
 * 표준 값은 표시와 분류 용도로만 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TokenStandard {

    ERC20("ERC-20"),
    ERC721("ERC-721"),
    ERC1155("ERC-1155"),
    ERC1400("ERC-1400"),
    ERC3525("ERC-3525"),
    ERC4626("ERC-4626");

    private final String code;

    TokenStandard(String code) {
        this.code = code;
    }

    /**
     * 저장소에 기록되는 표준 코드 (예: "ERC-20").
     *
     * @return 표준 코드
     */
    public String code() {
        return code;
    }

    /**
     * 표준 코드 해석.
     *
     * <p>"ERC-20", "ERC20", "erc-20" 형식을 모두 허용합니다.</p>
     *
     * @param code 표준 코드 (null 허용)
     * @return 해석된 표준, 알 수 없는 코드면 empty
     */
    public static Optional<TokenStandard> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace("-", "");
        for (TokenStandard standard : values()) {
            if (standard.name().equals(normalized)) {
                return Optional.of(standard);
            }
        }
        return Optional.empty();
    }
}
