package com.ryuqq.resilience.application.config;

import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.spi.QueueConfig;

import java.util.EnumMap;
import java.util.Map;

/**
 * 사용 시나리오별 설정 묶음.
 *
 * <p>추가 로직 없이 {@link ResilienceConfig} 값만 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResiliencePresets {

    private ResiliencePresets() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단일 에이전트용 기본 프리셋.
     *
     * <p>백엔드 기본 요금제의 동시 요청 한도(16)를 따릅니다.</p>
     */
    public static ResilienceConfig defaults() {
        return new ResilienceConfig(
            true,
            new RateLimiterConfig(100, 50),
            new ConcurrencyConfig(16, 1000, 30_000),
            new CircuitBreakerConfig(5, 2, 30_000, 3),
            queue(100, 500, 1000, 2000, 5000)
        );
    }

    /**
     * 실시간 대화용 프리셋: 작은 버스트, 작은 큐, 빠른 실패.
     */
    public static ResilienceConfig realTimeAgent() {
        return new ResilienceConfig(
            true,
            new RateLimiterConfig(30, 20),
            new ConcurrencyConfig(8, 100, 5_000),
            new CircuitBreakerConfig(3, 2, 10_000, 2),
            queue(50, 100, 200, 100, 50)
        );
    }

    /**
     * 대량 처리용 프리셋: 큰 버스트와 큰 큐, 실패에 관대함.
     */
    public static ResilienceConfig batchProcessing() {
        return new ResilienceConfig(
            true,
            new RateLimiterConfig(500, 100),
            new ConcurrencyConfig(64, 10_000, 60_000),
            new CircuitBreakerConfig(10, 3, 60_000, 5),
            queue(200, 1000, 5000, 10_000, 20_000)
        );
    }

    /**
     * 다수 에이전트가 하나의 백엔드를 공유하는 프리셋.
     */
    public static ResilienceConfig hiveMode() {
        return new ResilienceConfig(
            true,
            new RateLimiterConfig(1000, 200),
            new ConcurrencyConfig(128, 50_000, 120_000),
            new CircuitBreakerConfig(20, 5, 30_000, 10),
            queue(500, 5000, 20_000, 30_000, 50_000)
        );
    }

    /**
     * 모든 보호 장치를 우회.
     */
    public static ResilienceConfig disabled() {
        return new ResilienceConfig().withEnabled(false);
    }

    private static QueueConfig queue(int critical, int high, int normal, int low, int background) {
        Map<Priority, Integer> sizes = new EnumMap<>(Priority.class);
        sizes.put(Priority.CRITICAL, critical);
        sizes.put(Priority.HIGH, high);
        sizes.put(Priority.NORMAL, normal);
        sizes.put(Priority.LOW, low);
        sizes.put(Priority.BACKGROUND, background);
        return new QueueConfig(sizes);
    }
}
