package com.ryuqq.tokenflow.core.model;

import com.ryuqq.tokenflow.core.statemachine.TokenStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Token 스냅샷 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TokenTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final TokenId ID = TokenId.of("TKN-1");

    @Test
    void draft_StartsInDraftWithEqualTimestamps() {
        // When
        Token token = Token.draft(ID, "Bond A", TokenStandard.ERC1400, T0, null);

        // Then
        assertEquals(TokenStatus.DRAFT, token.currentStatus());
        assertEquals(T0, token.createdAt());
        assertEquals(T0, token.updatedAt());
        assertTrue(token.attributes().isEmpty());
    }

    @Test
    void withStatus_KeepsIdentityAndRefreshesUpdatedAt() {
        // Given
        Token token = Token.draft(ID, "Bond A", TokenStandard.ERC1400, T0, Map.of("issuer", "ACME"));
        Instant later = T0.plusSeconds(60);

        // When
        Token moved = token.withStatus(TokenStatus.UNDER_REVIEW, later);

        // Then
        assertEquals(TokenStatus.UNDER_REVIEW, moved.currentStatus());
        assertEquals(later, moved.updatedAt());
        assertEquals(T0, moved.createdAt());
        assertEquals("ACME", moved.attributeOrNull("issuer"));
        assertEquals(TokenStatus.DRAFT, token.currentStatus(), "Original snapshot must not change");
    }

    @Test
    void withStatus_EarlierUpdatedAt_ThrowsException() {
        // Given
        Token token = Token.draft(ID, "Bond A", TokenStandard.ERC20, T0, null);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> token.withStatus(TokenStatus.UNDER_REVIEW, T0.minusMillis(1))
        );
        assertTrue(exception.getMessage().contains("non-decreasing"));
    }

    @Test
    void constructor_UpdatedAtBeforeCreatedAt_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Token(ID, "Bond A", TokenStandard.ERC20, TokenStatus.DRAFT, T0, T0.minusSeconds(1), null));
    }

    @Test
    void constructor_BlankName_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Token.draft(ID, " ", TokenStandard.ERC20, T0, null));
    }

    @Test
    void attributes_AreDefensivelyCopied() {
        // Given
        Map<String, String> attributes = new HashMap<>();
        attributes.put("supply", "1000");
        Token token = Token.draft(ID, "Fund", TokenStandard.ERC4626, T0, attributes);

        // When
        attributes.put("supply", "0");

        // Then
        assertEquals("1000", token.attributeOrNull("supply"));
        assertNull(token.attributeOrNull("missing"));
        assertThrows(UnsupportedOperationException.class, () -> token.attributes().put("x", "y"));
    }
}
