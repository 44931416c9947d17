/**
 * Circuit Breaker 상태 머신 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.statemachine.CircuitTransition} 이
 * CLOSED → OPEN → HALF_OPEN → {CLOSED | OPEN} 전이 규칙을 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.statemachine;
