package com.ryuqq.tokenflow.core.model;

import java.util.regex.Pattern;

/**
 * 토큰의 전역 고유 식별자.
 *
 * <p>TokenId는 저장소의 토큰 행과 감사 기록을 연결하는 키이며,
 * 일반적으로 UUID 문자열이 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TokenId implements Comparable<TokenId> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String value;

    private TokenId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TokenId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TokenId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("TokenId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * TokenId 생성.
     *
     * @param value TokenId 값
     * @return TokenId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TokenId of(String value) {
        return new TokenId(value);
    }

    /**
     * TokenId 값 조회.
     *
     * @return TokenId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(TokenId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenId tokenId = (TokenId) o;
        return value.equals(tokenId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TokenId{" + value + '}';
    }
}
