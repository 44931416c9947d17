package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증 및 실행.
 *
 * <p>Circuit Breaker 의 상태 전이가 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (연속 실패 임계값 도달, 또는 강제 개방)</li>
 *   <li>OPEN → HALF_OPEN (OPEN 타임아웃 경과)</li>
 *   <li>HALF_OPEN → CLOSED (연속 성공 임계값 도달)</li>
 *   <li>HALF_OPEN → OPEN (probe 실패, 또는 강제 개방)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>자기 자신으로의 전이 불가</li>
 *   <li>CLOSED → HALF_OPEN, OPEN → CLOSED 불가</li>
 * </ul>
 *
 * <p>{@code reset()} 에 의한 CLOSED 재초기화는 전이가 아니므로 이 검증을 거치지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitTransition {

    // Utility class - prevent instantiation
    private CircuitTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid;
        switch (from) {
            case CLOSED:
                valid = to == CircuitBreakerState.OPEN;
                break;
            case OPEN:
                valid = to == CircuitBreakerState.HALF_OPEN;
                break;
            case HALF_OPEN:
                valid = to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이가 유효한지 여부 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     */
    public static boolean isAllowed(CircuitBreakerState from, CircuitBreakerState to) {
        try {
            validate(from, to);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }
}
