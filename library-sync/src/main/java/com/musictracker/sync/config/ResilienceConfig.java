package com.musictracker.sync.config;

import com.musictracker.sync.resilience.CircuitBreakerRegistry;
import com.musictracker.sync.resilience.RequestThrottle;
import com.musictracker.sync.resilience.RetryPolicy;
import com.musictracker.sync.resilience.Sleeper;
import com.musictracker.sync.service.DiscogsClient;
import com.musictracker.sync.service.LastFmClient;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Breakers, retry policies and throttles, one set per provider.
 */
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    private final LibrarySyncProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock) {
        return new CircuitBreakerRegistry(properties.getResilience(), clock);
    }

    @Bean
    public RetryPolicy discogsRetryPolicy(CircuitBreakerRegistry registry) {
        return new RetryPolicy(registry.circuitBreaker(DiscogsClient.DEPENDENCY), properties.getResilience().getRetry());
    }

    @Bean
    public RetryPolicy lastFmRetryPolicy(CircuitBreakerRegistry registry) {
        return new RetryPolicy(registry.circuitBreaker(LastFmClient.DEPENDENCY), properties.getResilience().getRetry());
    }

    @Bean
    public RequestThrottle discogsThrottle(Clock clock) {
        return new RequestThrottle(properties.getDiscogs().getRateLimitDelay(), clock, Sleeper.THREAD);
    }

    @Bean
    public RequestThrottle lastFmThrottle(Clock clock) {
        return new RequestThrottle(properties.getLastfm().getRateLimitDelay(), clock, Sleeper.THREAD);
    }
}
