package com.ryuqq.resilience.adapter.inmemory.concurrency;

import com.ryuqq.resilience.core.protection.ConcurrencyConfig;
import com.ryuqq.resilience.core.protection.ConcurrencyLimiter;
import com.ryuqq.resilience.testkit.contract.ConcurrencyLimiterContract;

/**
 * Contract Test for {@link FairSemaphore}.
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see ConcurrencyLimiterContract
 */
class FairSemaphoreContractTest extends ConcurrencyLimiterContract {

    @Override
    protected ConcurrencyLimiter createLimiter(ConcurrencyConfig config) {
        return new FairSemaphore(config);
    }
}
