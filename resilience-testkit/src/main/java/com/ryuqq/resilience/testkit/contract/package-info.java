/**
 * SPI 계약 테스트 패키지.
 *
 * <p>각 SPI 구현체는 해당 {@code *Contract} 추상 클래스를 상속한 테스트를 작성하여
 * 동일한 계약을 검증합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.testkit.contract.RateLimiterContract}</li>
 *   <li>{@link com.ryuqq.resilience.testkit.contract.ConcurrencyLimiterContract}</li>
 *   <li>{@link com.ryuqq.resilience.testkit.contract.RequestQueueContract}</li>
 *   <li>{@link com.ryuqq.resilience.testkit.contract.CircuitBreakerContract}</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.contract;
