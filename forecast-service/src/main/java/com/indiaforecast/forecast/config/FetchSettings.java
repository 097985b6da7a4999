package com.indiaforecast.forecast.config;

import com.indiaforecast.common.exception.InvalidConfigurationException;

import java.time.Duration;

/**
 * Network and cache tunables for source fetching, bound from {@code forecast.fetch.*} and
 * {@code forecast.cache.*}. Invalid values fail fast at startup.
 */
public record FetchSettings(
    Duration requestTimeout,
    int maxRetries,
    Duration initialBackoff,
    Duration interRequestDelay,
    int maxConcurrentRequests,
    Duration liveTtl,
    Duration historicalTtl
) {
    public FetchSettings {
        requirePositive("forecast.fetch.request-timeout", requestTimeout);
        if (maxRetries < 0) {
            throw new InvalidConfigurationException("forecast.fetch.max-retries", "must be >= 0, got " + maxRetries);
        }
        requirePositive("forecast.fetch.initial-backoff", initialBackoff);
        if (interRequestDelay == null || interRequestDelay.isNegative()) {
            throw new InvalidConfigurationException("forecast.fetch.inter-request-delay",
                "must be zero or positive, got " + interRequestDelay);
        }
        if (maxConcurrentRequests < 1) {
            throw new InvalidConfigurationException("forecast.fetch.max-concurrent-requests",
                "must be >= 1, got " + maxConcurrentRequests);
        }
        requirePositive("forecast.cache.live-ttl", liveTtl);
        requirePositive("forecast.cache.historical-ttl", historicalTtl);
    }

    public static FetchSettings defaults() {
        return new FetchSettings(Duration.ofSeconds(30), 3, Duration.ofMillis(500), Duration.ofSeconds(1), 4,
            Duration.ofHours(1), Duration.ofDays(3650));
    }

    private static void requirePositive(String property, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidConfigurationException(property, "must be a positive duration, got " + value);
        }
    }
}
