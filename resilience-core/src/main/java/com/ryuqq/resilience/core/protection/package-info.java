/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>원격 백엔드를 과부하로부터 보호하기 위한 확장점을 정의합니다.
 * Rate Limiter, 동시성 제한기(Bulkhead), Circuit Breaker 와 각 설정 record 를 포함합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <p>{@code ResilienceLayer} 는 다음 순서로 보호 요소를 적용합니다:</p>
 * <pre>
 * 1. CircuitBreaker      → OPEN 상태 시 즉시 거부 (작업 미실행)
 * 2. PriorityClassifier  → 작업 이름으로 우선순위 결정
 * 3. RateLimiter         → 토큰 대기 (제한 시간 내)
 * 4. ConcurrencyLimiter  → permit 대기, 또는 우선순위 큐로 지연
 * 5. 작업 실행
 * 6. CircuitBreaker      → 성공/실패 기록
 * 7. Permit 반환          → finally
 * </pre>
 *
 * <h3>체인 순서 선정 이유</h3>
 * <ul>
 *   <li><strong>Circuit Breaker First:</strong> 실패 중인 백엔드에 대해 토큰과 permit 을 소비하지 않음</li>
 *   <li><strong>Rate Limiter:</strong> QPS 제어</li>
 *   <li><strong>Concurrency:</strong> 동시 실행 제어 (마지막 체크포인트)</li>
 * </ul>
 *
 * <h2>구현체</h2>
 *
 * <p>프로세스 로컬 구현은 {@code resilience-adapter-inmemory} 모듈에 있습니다.
 * 계약 테스트는 {@code resilience-testkit} 모듈이 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.RateLimiter
 * @see com.ryuqq.resilience.core.protection.ConcurrencyLimiter
 */
package com.ryuqq.resilience.core.protection;
