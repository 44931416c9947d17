/**
 * 테스트용 시계.
 */
package com.ryuqq.resilience.testkit.clock;
