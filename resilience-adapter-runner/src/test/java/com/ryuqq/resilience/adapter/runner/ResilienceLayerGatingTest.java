package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.config.ResilienceConfig;
import com.ryuqq.resilience.core.event.ResilienceListener;
import com.ryuqq.resilience.core.exception.AcquireTimeoutException;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.RateLimitExceededException;
import com.ryuqq.resilience.core.priority.OperationPriorities;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.spi.RequestQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResilienceLayer 유닛 테스트.
 *
 * <p>보호 장치를 mock 으로 주입해 호출 순서와 자원 반환을 검증합니다:</p>
 * <ul>
 *   <li>Circuit → Rate Limiter → 동시성 제한 → 실행 → 보고 → 반환 순서 보장</li>
 *   <li>뒤 단계에서 거부되면 앞 단계에서 얻은 probe 슬롯 반환</li>
 *   <li>작업 실패 시에도 permit 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResilienceLayerGatingTest {

    private static final long TIMEOUT_MS = 30_000;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private ConcurrencyLimiter concurrencyLimiter;

    @Mock
    private RequestQueue queue;

    @Mock
    private CircuitBreaker circuitBreaker;

    @Mock
    private CallPermission permission;

    @Mock
    private ConcurrencyLimiter.Permit permit;

    private ResilienceLayer layer;

    @BeforeEach
    void setUp() {
        layer = new ResilienceLayer(new ResilienceConfig(), rateLimiter, concurrencyLimiter, queue,
            circuitBreaker, OperationPriorities.defaults(), ResilienceListener.NONE, Clock.systemUTC(),
            new QueueDrainerConfig());
        // drain 루프가 mock 과 경쟁하지 않도록 중단
        layer.stopQueueProcessor();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        layer.shutdown(0);
    }

    // ============================================================
    // 1. 호출 순서
    // ============================================================

    @Test
    void execute_는_Circuit_RateLimiter_동시성_순서로_통과한_뒤_permit_을_반환한다() throws Exception {
        // given
        when(circuitBreaker.acquirePermission()).thenReturn(permission);
        when(concurrencyLimiter.acquire(TIMEOUT_MS)).thenReturn(permit);

        // when
        String result = layer.execute(() -> "ok", "memory:remember");

        // then
        assertThat(result).isEqualTo("ok");
        InOrder inOrder = inOrder(circuitBreaker, rateLimiter, concurrencyLimiter, permission, permit);
        inOrder.verify(circuitBreaker).acquirePermission();
        inOrder.verify(rateLimiter).acquire(1, TIMEOUT_MS);
        inOrder.verify(concurrencyLimiter).acquire(TIMEOUT_MS);
        inOrder.verify(permission).onSuccess();
        inOrder.verify(permit).release();
    }

    @Test
    void 작업이_실패하면_onFailure_를_보고하고_permit_을_반환한다() throws Exception {
        // given
        when(circuitBreaker.acquirePermission()).thenReturn(permission);
        when(concurrencyLimiter.acquire(TIMEOUT_MS)).thenReturn(permit);
        IOException failure = new IOException("backend down");

        // when
        assertThatThrownBy(() -> layer.execute(() -> {
            throw failure;
        }, "memory:remember")).isSameAs(failure);

        // then
        verify(permission).onFailure(failure);
        verify(permission, never()).onSuccess();
        verify(permit).release();
    }

    // ============================================================
    // 2. 거부 시 자원 반환
    // ============================================================

    @Test
    void Circuit_이_거부하면_RateLimiter_를_호출하지_않는다() throws Exception {
        // given
        when(circuitBreaker.acquirePermission()).thenThrow(new CircuitOpenException(5_000));

        // when / then
        assertThatThrownBy(() -> layer.execute(() -> "x", "memory:remember"))
            .isInstanceOf(CircuitOpenException.class);
        verify(rateLimiter, never()).acquire(anyInt(), anyLong());
        verify(concurrencyLimiter, never()).acquire(anyLong());
    }

    @Test
    void RateLimiter_가_거부하면_probe_슬롯을_반환하고_permit_을_요청하지_않는다() throws Exception {
        // given
        when(circuitBreaker.acquirePermission()).thenReturn(permission);
        doThrow(new RateLimitExceededException(1, 0, 1_000)).when(rateLimiter).acquire(1, TIMEOUT_MS);

        // when / then
        assertThatThrownBy(() -> layer.execute(() -> "x", "memory:remember"))
            .isInstanceOf(RateLimitExceededException.class);
        verify(permission).release();
        verify(permission, never()).onFailure(any());
        verify(concurrencyLimiter, never()).acquire(anyLong());
    }

    @Test
    void 동시성_대기가_timeout_되면_probe_슬롯을_반환한다() throws Exception {
        // given
        when(circuitBreaker.acquirePermission()).thenReturn(permission);
        when(concurrencyLimiter.acquire(TIMEOUT_MS)).thenThrow(new AcquireTimeoutException(TIMEOUT_MS, 3));

        // when / then
        assertThatThrownBy(() -> layer.execute(() -> "x", "memory:remember"))
            .isInstanceOf(AcquireTimeoutException.class);
        verify(permission).release();
        verify(permission, never()).onSuccess();
    }
}
