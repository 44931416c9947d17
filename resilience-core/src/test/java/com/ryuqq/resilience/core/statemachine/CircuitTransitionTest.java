package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static com.ryuqq.resilience.core.protection.CircuitBreakerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitTransition 테스트.
 *
 * <ul>
 *   <li>CLOSED → OPEN → HALF_OPEN → CLOSED 정상 순환</li>
 *   <li>HALF_OPEN → OPEN 재개방</li>
 *   <li>CLOSED → HALF_OPEN, OPEN → CLOSED 및 자기 전이 거부</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CircuitTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_ClosedToOpen_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> CircuitTransition.validate(CLOSED, OPEN));
    }

    @Test
    void validate_HalfOpenToOpen_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> CircuitTransition.validate(HALF_OPEN, OPEN));
    }

    @Test
    void transition_FullRecoveryCycle_Succeeds() {
        // Given
        CircuitBreakerState state = CLOSED;

        // When
        state = CircuitTransition.transition(state, OPEN);
        state = CircuitTransition.transition(state, HALF_OPEN);
        state = CircuitTransition.transition(state, CLOSED);

        // Then
        assertEquals(CLOSED, state);
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_ClosedToHalfOpen_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> CircuitTransition.validate(CLOSED, HALF_OPEN)
        );
        assertTrue(exception.getMessage().contains("CLOSED"));
        assertTrue(exception.getMessage().contains("HALF_OPEN"));
    }

    @Test
    void validate_OpenToClosed_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(OPEN, CLOSED));
    }

    @Test
    void validate_SelfTransition_ThrowsException() {
        // When & Then
        for (CircuitBreakerState state : CircuitBreakerState.values()) {
            assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(state, state));
        }
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CircuitTransition.validate(null, OPEN));
        assertThrows(IllegalArgumentException.class, () -> CircuitTransition.validate(CLOSED, null));
    }

    @Test
    void isAllowed_ReturnsFalseInsteadOfThrowing() {
        // When & Then
        assertTrue(CircuitTransition.isAllowed(OPEN, HALF_OPEN));
        assertFalse(CircuitTransition.isAllowed(OPEN, CLOSED));
    }
}
