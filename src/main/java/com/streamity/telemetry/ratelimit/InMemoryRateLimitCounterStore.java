package com.streamity.telemetry.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-local counter store.
 * <p>
 * ConcurrentHashMap#compute runs the transition atomically per key, so two requests
 * of the same identity are serialized while different identities proceed in parallel.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "telemetry.rate-limit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitCounterStore implements RateLimitCounterStore {

    private final ConcurrentMap<String, RateLimitCounter> counters = new ConcurrentHashMap<>();

    @Override
    public RateLimitCounter update(String identity, UnaryOperator<RateLimitCounter> transition) {
        return counters.compute(identity, (key, current) -> transition.apply(current));
    }

    @Override
    public Optional<RateLimitCounter> find(String identity) {
        return Optional.ofNullable(counters.get(identity));
    }

    @Override
    public long size() {
        return counters.size();
    }
}
