/**
 * Resilience Layer 조립 및 백그라운드 drain 루프.
 *
 * <p>{@link com.ryuqq.resilience.adapter.runner.ResilienceLayer} 가 인메모리 보호 장치를 묶어
 * {@code ResilienceGate} 를 구현하고, {@link com.ryuqq.resilience.adapter.runner.QueueDrainer} 가
 * 우선순위 큐에 지연된 요청을 용량이 생기는 대로 실행합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
