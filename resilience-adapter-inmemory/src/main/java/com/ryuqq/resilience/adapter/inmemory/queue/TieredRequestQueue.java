package com.ryuqq.resilience.adapter.inmemory.queue;

import com.ryuqq.resilience.core.contract.QueuedRequest;
import com.ryuqq.resilience.core.exception.QueueFullException;
import com.ryuqq.resilience.core.metrics.QueueMetrics;
import com.ryuqq.resilience.core.model.Priority;
import com.ryuqq.resilience.core.model.RequestId;
import com.ryuqq.resilience.core.spi.QueueConfig;
import com.ryuqq.resilience.core.spi.RequestQueue;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 5단계 티어로 구성된 in-memory {@link RequestQueue} 구현.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Tiers:</strong> {@code EnumMap<Priority, ArrayDeque>} - 티어별 FIFO 큐</li>
 *   <li><strong>Limits:</strong> {@link QueueConfig} - 티어별 독립 최대 크기</li>
 *   <li><strong>Lock:</strong> 단일 {@link ReentrantLock}</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>enqueue/dequeue/dequeueIf/peek:</strong> O(1) (티어 수는 상수)</li>
 *   <li><strong>cancel/removeExpired:</strong> O(N)</li>
 * </ul>
 *
 * <p>큐에서 제거된 요청의 실패 처리(완료 핸들 호출)는 락 밖에서 수행됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class TieredRequestQueue implements RequestQueue {

    private final QueueConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Priority, Deque<QueuedRequest<?>>> tiers = new EnumMap<>(Priority.class);

    private long processed;
    private long dropped;

    public TieredRequestQueue(QueueConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * TieredRequestQueue 생성.
     *
     * @param config 티어별 최대 크기
     * @param clock 요청 대기 시간 계산용 시간 소스
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public TieredRequestQueue(QueueConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        for (Priority priority : Priority.PROCESSING_ORDER) {
            tiers.put(priority, new ArrayDeque<>());
        }
    }

    @Override
    public void enqueue(QueuedRequest<?> request) {
        if (!tryEnqueue(request)) {
            throw new QueueFullException(request.priority(), config.maxSize(request.priority()));
        }
    }

    @Override
    public boolean tryEnqueue(QueuedRequest<?> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        lock.lock();
        try {
            Deque<QueuedRequest<?>> tier = tiers.get(request.priority());
            if (tier.size() >= config.maxSize(request.priority())) {
                dropped++;
                return false;
            }
            tier.addLast(request);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueuedRequest<?> dequeue() {
        lock.lock();
        try {
            for (Priority priority : Priority.PROCESSING_ORDER) {
                QueuedRequest<?> head = tiers.get(priority).pollFirst();
                if (head != null) {
                    processed++;
                    return head;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueuedRequest<?> dequeueIf(Predicate<? super QueuedRequest<?>> admission) {
        if (admission == null) {
            throw new IllegalArgumentException("admission cannot be null");
        }
        lock.lock();
        try {
            for (Priority priority : Priority.PROCESSING_ORDER) {
                Deque<QueuedRequest<?>> tier = tiers.get(priority);
                QueuedRequest<?> head = tier.peekFirst();
                if (head != null) {
                    if (!admission.test(head)) {
                        return null;
                    }
                    tier.pollFirst();
                    processed++;
                    return head;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueuedRequest<?> peek() {
        lock.lock();
        try {
            for (Priority priority : Priority.PROCESSING_ORDER) {
                QueuedRequest<?> head = tiers.get(priority).peekFirst();
                if (head != null) {
                    return head;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return sizeLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<Priority, Integer> sizeByPriority() {
        lock.lock();
        try {
            return sizeByPriorityLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean hasCapacity(Priority priority) {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        lock.lock();
        try {
            return tiers.get(priority).size() < config.maxSize(priority);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Long getOldestRequestAgeMs() {
        lock.lock();
        try {
            return oldestAgeLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int removeExpired(long maxAgeMs) {
        List<QueuedRequest<?>> expired = new ArrayList<>();
        lock.lock();
        try {
            long now = clock.millis();
            for (Deque<QueuedRequest<?>> tier : tiers.values()) {
                Iterator<QueuedRequest<?>> iterator = tier.iterator();
                while (iterator.hasNext()) {
                    QueuedRequest<?> request = iterator.next();
                    if (now - request.queuedAt() > maxAgeMs) {
                        iterator.remove();
                        expired.add(request);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        for (QueuedRequest<?> request : expired) {
            request.fail(new TimeoutException("Request expired after " + maxAgeMs + "ms in queue"));
        }
        return expired.size();
    }

    @Override
    public boolean cancel(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        QueuedRequest<?> cancelled = null;
        lock.lock();
        try {
            for (Deque<QueuedRequest<?>> tier : tiers.values()) {
                Iterator<QueuedRequest<?>> iterator = tier.iterator();
                while (iterator.hasNext()) {
                    QueuedRequest<?> request = iterator.next();
                    if (request.id().equals(requestId)) {
                        iterator.remove();
                        cancelled = request;
                        break;
                    }
                }
                if (cancelled != null) {
                    break;
                }
            }
        } finally {
            lock.unlock();
        }
        if (cancelled == null) {
            return false;
        }
        cancelled.fail(new CancellationException("Request cancelled"));
        return true;
    }

    @Override
    public void clear() {
        List<QueuedRequest<?>> removed = new ArrayList<>();
        lock.lock();
        try {
            for (Deque<QueuedRequest<?>> tier : tiers.values()) {
                removed.addAll(tier);
                tier.clear();
            }
        } finally {
            lock.unlock();
        }
        for (QueuedRequest<?> request : removed) {
            request.fail(new IllegalStateException("Queue cleared"));
        }
    }

    @Override
    public QueueMetrics getMetrics() {
        lock.lock();
        try {
            return new QueueMetrics(sizeLocked(), sizeByPriorityLocked(), processed, dropped, oldestAgeLocked());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resetMetrics() {
        lock.lock();
        try {
            processed = 0;
            dropped = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueConfig getConfig() {
        return config;
    }

    private int sizeLocked() {
        int total = 0;
        for (Deque<QueuedRequest<?>> tier : tiers.values()) {
            total += tier.size();
        }
        return total;
    }

    private Map<Priority, Integer> sizeByPriorityLocked() {
        Map<Priority, Integer> sizes = new EnumMap<>(Priority.class);
        for (Map.Entry<Priority, Deque<QueuedRequest<?>>> entry : tiers.entrySet()) {
            sizes.put(entry.getKey(), entry.getValue().size());
        }
        return Collections.unmodifiableMap(sizes);
    }

    private Long oldestAgeLocked() {
        Long oldestQueuedAt = null;
        for (Deque<QueuedRequest<?>> tier : tiers.values()) {
            QueuedRequest<?> head = tier.peekFirst();
            if (head != null && (oldestQueuedAt == null || head.queuedAt() < oldestQueuedAt)) {
                oldestQueuedAt = head.queuedAt();
            }
        }
        return oldestQueuedAt == null ? null : clock.millis() - oldestQueuedAt;
    }
}
