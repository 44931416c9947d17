package com.ryuqq.resilience.adapter.runner;

/**
 * QueueDrainer 설정 (불변 record).
 *
 * <p>백그라운드 drain 루프와 worker pool 의 동작을 제어합니다. 동시 실행 수 자체는
 * {@code ConcurrencyConfig.maxConcurrent} 가 결정하며, 이 설정은 루프의 타이밍만 다룹니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 신호가 없을 때 큐를 다시 확인하는 간격 (기본 100ms)</li>
 *   <li>errorDelayMs: pump 사이클 실패 후 대기 시간 (기본 1000ms)</li>
 *   <li>shutdownAwaitMs: worker pool 종료 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 지연: pollingIntervalMs 감소 (100 → 10). 대부분의 drain 은 신호로 깨어나므로 효과는 제한적</li>
 *   <li>자원 절약: pollingIntervalMs 증가</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param pollingIntervalMs 폴링 간격 (밀리초, 양수여야 함)
 * @param errorDelayMs 오류 후 대기 시간 (밀리초, 0 이상)
 * @param shutdownAwaitMs worker pool 종료 대기 시간 (밀리초, 0 이상)
 */
public record QueueDrainerConfig(
    long pollingIntervalMs,
    long errorDelayMs,
    long shutdownAwaitMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=100ms, errorDelayMs=1000ms, shutdownAwaitMs=5000ms</p>
     */
    public QueueDrainerConfig() {
        this(100, 1000, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueDrainerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (errorDelayMs < 0) {
            throw new IllegalArgumentException(
                "errorDelayMs cannot be negative (current: " + errorDelayMs + ")"
            );
        }
        if (shutdownAwaitMs < 0) {
            throw new IllegalArgumentException(
                "shutdownAwaitMs cannot be negative (current: " + shutdownAwaitMs + ")"
            );
        }
    }

    public QueueDrainerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new QueueDrainerConfig(pollingIntervalMs, errorDelayMs, shutdownAwaitMs);
    }

    public QueueDrainerConfig withErrorDelayMs(long errorDelayMs) {
        return new QueueDrainerConfig(pollingIntervalMs, errorDelayMs, shutdownAwaitMs);
    }

    public QueueDrainerConfig withShutdownAwaitMs(long shutdownAwaitMs) {
        return new QueueDrainerConfig(pollingIntervalMs, errorDelayMs, shutdownAwaitMs);
    }
}
