package com.ryuqq.resilience.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestId Value Object 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class RequestIdTest {

    @Test
    void of_ValidValue_CreatesRequestId() {
        // When
        RequestId id = RequestId.of("req-123_abc");

        // Then
        assertEquals("req-123_abc", id.getValue());
        assertEquals(RequestId.of("req-123_abc"), id);
        assertEquals(id.hashCode(), RequestId.of("req-123_abc").hashCode());
    }

    @Test
    void next_GeneratesUniqueIdsWithTimestamp() {
        // When
        RequestId first = RequestId.next(1000L);
        RequestId second = RequestId.next(1000L);

        // Then
        assertTrue(first.getValue().startsWith("req_1000_"));
        assertNotEquals(first, second);
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RequestId.of(null)
        );
        assertEquals("requestId cannot be null or blank", exception.getMessage());
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> RequestId.of("req 1"));
        assertThrows(IllegalArgumentException.class, () -> RequestId.of("req:1"));
    }

    @Test
    void of_LeadingDigitOrSeparator_ThrowsException() {
        // When
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RequestId.of("1700000000000_1")
        );

        // Then
        assertTrue(exception.getMessage().startsWith("requestId must start with a letter"));
        assertThrows(IllegalArgumentException.class, () -> RequestId.of("_req"));
    }

    @Test
    void of_LengthLimit_AllowsGeneratedIdsAndRejectsLongerValues() {
        // Given
        String longest = "r".repeat(RequestId.MAX_LENGTH);

        // When & Then
        assertEquals(longest, RequestId.of(longest).getValue());
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RequestId.of(longest + "x")
        );
        assertEquals("requestId must be at most 64 characters (current: 65)", exception.getMessage());
        assertTrue(RequestId.next(Long.MAX_VALUE).getValue().length() <= RequestId.MAX_LENGTH);
    }
}
