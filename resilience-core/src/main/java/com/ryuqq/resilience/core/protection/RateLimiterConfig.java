package com.ryuqq.resilience.core.protection;

/**
 * Rate Limiter (Token Bucket) 설정.
 *
 * <p>Java record를 사용하여 불변성을 보장합니다.</p>
 *
 * @param bucketSize 버스트 허용량 (버킷 크기, 기본 100)
 * @param refillRate 초당 토큰 충전량 (기본 50, 소수 허용)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int bucketSize, double refillRate) {

    public static final int DEFAULT_BUCKET_SIZE = 100;
    public static final double DEFAULT_REFILL_RATE = 50;

    /**
     * 기본 설정 생성자 (bucketSize=100, refillRate=50/s).
     */
    public RateLimiterConfig() {
        this(DEFAULT_BUCKET_SIZE, DEFAULT_REFILL_RATE);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if bucketSize is not positive
     * @throws IllegalArgumentException if refillRate is not positive
     */
    public RateLimiterConfig {
        if (bucketSize <= 0) {
            throw new IllegalArgumentException("bucketSize must be positive (current: " + bucketSize + ")");
        }
        if (!(refillRate > 0) || Double.isInfinite(refillRate)) {
            throw new IllegalArgumentException("refillRate must be positive and finite (current: " + refillRate + ")");
        }
    }

    public RateLimiterConfig withBucketSize(int bucketSize) {
        return new RateLimiterConfig(bucketSize, refillRate);
    }

    public RateLimiterConfig withRefillRate(double refillRate) {
        return new RateLimiterConfig(bucketSize, refillRate);
    }
}
