/**
 * Service Provider Interface (SPI) 패키지.
 *
 * <p>지연 요청을 보관하는 우선순위 큐 추상화({@link com.ryuqq.resilience.core.spi.RequestQueue})와
 * 그 설정({@link com.ryuqq.resilience.core.spi.QueueConfig})을 정의합니다.</p>
 *
 * <p>구현체는 {@code resilience-adapter-inmemory} 모듈의 {@code TieredRequestQueue} 입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
