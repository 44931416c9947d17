package com.ryuqq.resilience.application.runtime;

/**
 * Deferred Request Runtime.
 *
 * <p>This interface defines the drain behavior for requests that were deferred
 * into the priority queue.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * while (queue not empty):
 *   1. Acquire circuit permission (stop if rejected)
 *   2. Acquire concurrency permit without waiting (stop if none)
 *   3. Dequeue the highest-priority request
 *   4. Dispatch to the worker pool:
 *      a. Invoke operation
 *      b. Report outcome to circuit breaker
 *      c. Complete the request's future
 *      d. Release permit
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked by a single background drain thread</li>
 *   <li>The thread wakes on a signal (enqueue, permit release) or a polling interval</li>
 *   <li>Graceful shutdown support (interrupt the loop cleanly)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle.
     *
     * <p>Dispatches as many queued requests as the circuit breaker and the
     * concurrency limiter currently allow, then returns. Never blocks waiting
     * for capacity.</p>
     *
     * @return number of requests dispatched in this cycle
     * @throws IllegalStateException if the runtime has been shut down
     */
    int pump();
}
