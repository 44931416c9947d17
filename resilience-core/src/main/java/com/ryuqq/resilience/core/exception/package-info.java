/**
 * 합성 거부 예외 패키지.
 *
 * <p>보호 계층이 작업 대신 던지는 네 가지 예외를 정의합니다.
 * 모두 {@link com.ryuqq.resilience.core.exception.ResilienceException} 의 하위 타입이며
 * unchecked 입니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.exception.RateLimitExceededException}</li>
 *   <li>{@link com.ryuqq.resilience.core.exception.AcquireTimeoutException}</li>
 *   <li>{@link com.ryuqq.resilience.core.exception.QueueFullException}</li>
 *   <li>{@link com.ryuqq.resilience.core.exception.CircuitOpenException}</li>
 * </ul>
 *
 * <p>감싼 작업이 던진 예외는 이 패키지의 타입으로 감싸지지 않고 그대로 전파됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.exception;
