package com.ryuqq.tokenflow.core.model;

import com.ryuqq.tokenflow.core.statemachine.TokenStatus;

import java.time.Instant;
import java.util.Map;

/**
 * 생명주기 관리 대상 토큰의 스냅샷.
 *
 * <p>Token은 불변 스냅샷이며, 상태 변경은 오직 상태 변경 커맨드가
 * {@link #withStatus(TokenStatus, Instant)}로 만든 새 스냅샷을 저장소에 기록하는 방식으로만 이루어집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>정확히 하나의 currentStatus</li>
 *   <li>updatedAt &gt;= createdAt</li>
 * </ul>
 *
 * <p>attributes는 표준별 속성을 담는 불투명 맵으로, 라이브러리 코어는 해석하지 않습니다.
 * 호출자가 주입한 전이 전제조건만 읽을 수 있습니다.</p>
 *
 * @param id 토큰 ID
 * @param name 토큰 이름
 * @param standard 토큰 표준
 * @param currentStatus 현재 상태
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 상태 전이 시각
 * @param attributes 불투명 속성 (null이면 빈 맵)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Token(
    TokenId id,
    String name,
    TokenStandard standard,
    TokenStatus currentStatus,
    Instant createdAt,
    Instant updatedAt,
    Map<String, String> attributes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 updatedAt이 createdAt보다 이전인 경우
     */
    public Token {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (standard == null) {
            throw new IllegalArgumentException("standard cannot be null");
        }
        if (currentStatus == null) {
            throw new IllegalArgumentException("currentStatus cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException(
                "updatedAt cannot be before createdAt (createdAt: " + createdAt + ", updatedAt: " + updatedAt + ")");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * DRAFT 상태의 신규 토큰 생성.
     *
     * @param id 토큰 ID
     * @param name 토큰 이름
     * @param standard 토큰 표준
     * @param createdAt 생성 시각 (updatedAt도 동일)
     * @param attributes 불투명 속성 (null 허용)
     * @return DRAFT 토큰
     */
    public static Token draft(TokenId id, String name, TokenStandard standard,
                              Instant createdAt, Map<String, String> attributes) {
        return new Token(id, name, standard, TokenStatus.DRAFT, createdAt, createdAt, attributes);
    }

    /**
     * 상태와 갱신 시각만 바꾼 새 스냅샷 생성.
     *
     * @param status 새 상태
     * @param newUpdatedAt 새 갱신 시각
     * @return 새 Token 인스턴스
     * @throws IllegalArgumentException newUpdatedAt이 현재 updatedAt보다 이전인 경우
     */
    public Token withStatus(TokenStatus status, Instant newUpdatedAt) {
        if (newUpdatedAt == null || newUpdatedAt.isBefore(updatedAt)) {
            throw new IllegalArgumentException(
                "updatedAt must be non-decreasing (current: " + updatedAt + ", new: " + newUpdatedAt + ")");
        }
        return new Token(id, name, standard, status, createdAt, newUpdatedAt, attributes);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값 또는 null
     */
    public String attributeOrNull(String key) {
        return attributes.get(key);
    }
}
