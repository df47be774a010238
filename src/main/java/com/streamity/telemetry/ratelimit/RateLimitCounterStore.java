package com.streamity.telemetry.ratelimit;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed store of {@link RateLimitCounter}s, one per caller identity.
 * Counters are never removed.
 */
public interface RateLimitCounterStore {

    /**
     * Read-modify-write the identity's counter as one step with respect to other
     * updates of the same identity.
     *
     * @param identity   caller identity
     * @param transition receives the current counter (null if none) and returns the counter to store;
     *                   returning null leaves an absent identity absent
     * @return the stored counter, null if the identity still has none
     */
    RateLimitCounter update(String identity, UnaryOperator<RateLimitCounter> transition);

    Optional<RateLimitCounter> find(String identity);

    long size();
}
