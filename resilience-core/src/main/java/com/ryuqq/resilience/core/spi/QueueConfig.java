package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.Priority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 우선순위 큐 설정 (티어별 최대 크기).
 *
 * <p>지정하지 않은 티어는 기본값을 사용합니다:
 * critical=100, high=500, normal=1000, low=2000, background=5000.</p>
 *
 * @param maxSizePerTier 티어별 최대 대기 요청 수 (다섯 티어 모두 포함)
 * @author Resilience Team
 * @since 1.0.0
 */
public record QueueConfig(Map<Priority, Integer> maxSizePerTier) {

    private static final Map<Priority, Integer> DEFAULT_SIZES = Map.of(
        Priority.CRITICAL, 100,
        Priority.HIGH, 500,
        Priority.NORMAL, 1000,
        Priority.LOW, 2000,
        Priority.BACKGROUND, 5000
    );

    /**
     * 기본 설정 생성자.
     */
    public QueueConfig() {
        this(DEFAULT_SIZES);
    }

    /**
     * Compact constructor.
     *
     * <p>누락된 티어는 기본값으로 채웁니다.</p>
     *
     * @throws IllegalArgumentException 음수 크기가 있는 경우
     */
    public QueueConfig {
        if (maxSizePerTier == null) {
            throw new IllegalArgumentException("maxSizePerTier cannot be null");
        }
        Map<Priority, Integer> merged = new EnumMap<>(Priority.class);
        merged.putAll(DEFAULT_SIZES);
        for (Map.Entry<Priority, Integer> entry : maxSizePerTier.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("maxSizePerTier cannot contain null keys or values");
            }
            if (entry.getValue() < 0) {
                throw new IllegalArgumentException(
                    "maxSize for " + entry.getKey().label() + " cannot be negative (current: " + entry.getValue() + ")");
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        maxSizePerTier = Collections.unmodifiableMap(merged);
    }

    /**
     * 특정 티어의 최대 크기 조회.
     *
     * @param priority 티어
     * @return 최대 크기
     */
    public int maxSize(Priority priority) {
        return maxSizePerTier.get(priority);
    }

    /**
     * 특정 티어의 최대 크기만 변경한 새 인스턴스 생성.
     *
     * @throws IllegalArgumentException priority가 null이거나 maxSize가 음수인 경우
     */
    public QueueConfig withMaxSize(Priority priority, int maxSize) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        Map<Priority, Integer> copy = new EnumMap<>(maxSizePerTier);
        copy.put(priority, maxSize);
        return new QueueConfig(copy);
    }

    /**
     * 모든 티어의 최대 크기 합계.
     *
     * @return 전체 용량
     */
    public long totalCapacity() {
        long total = 0;
        for (int size : maxSizePerTier.values()) {
            total += size;
        }
        return total;
    }
}
