package com.musictracker.sync.resilience;

import com.musictracker.sync.config.LibrarySyncProperties;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one breaker per dependency for the life of the process.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final LibrarySyncProperties.Resilience config;
    private final Clock clock;

    public CircuitBreakerRegistry(LibrarySyncProperties.Resilience config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public CircuitBreaker circuitBreaker(String dependency) {
        return breakers.computeIfAbsent(dependency, name -> {
            LibrarySyncProperties.Resilience.Breaker settings = config.breakerFor(name);
            return new CircuitBreaker(name,
                    settings.getFailureThreshold(),
                    settings.getSuccessThreshold(),
                    settings.getRecoveryTimeout(),
                    clock);
        });
    }

    public List<CircuitBreaker.Snapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .toList();
    }
}
