/**
 * 동시성 제한(Bulkhead) 구현 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.concurrency;
