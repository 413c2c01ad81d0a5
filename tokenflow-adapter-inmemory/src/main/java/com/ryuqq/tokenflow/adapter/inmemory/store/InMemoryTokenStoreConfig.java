package com.ryuqq.tokenflow.adapter.inmemory.store;

/**
 * InMemoryTokenStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>lockTimeoutMs: 커밋 시 토큰 잠금 획득 대기 시간 (기본 1000ms).
 *       초과하면 커밋은 적용되지 않고 TokenStoreException이 발생합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param lockTimeoutMs 잠금 대기 시간 (밀리초, 양수여야 함)
 */
public record InMemoryTokenStoreConfig(long lockTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: lockTimeoutMs=1000ms</p>
     */
    public InMemoryTokenStoreConfig() {
        this(1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InMemoryTokenStoreConfig {
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "lockTimeoutMs must be positive (current: " + lockTimeoutMs + ")"
            );
        }
    }

    /**
     * lockTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param lockTimeoutMs 새로운 잠금 대기 시간 (밀리초)
     * @return 새 InMemoryTokenStoreConfig 인스턴스
     */
    public InMemoryTokenStoreConfig withLockTimeoutMs(long lockTimeoutMs) {
        return new InMemoryTokenStoreConfig(lockTimeoutMs);
    }
}
