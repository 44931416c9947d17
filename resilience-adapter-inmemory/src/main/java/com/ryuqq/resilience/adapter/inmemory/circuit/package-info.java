/**
 * Circuit Breaker 구현 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.circuit;
