package com.indiaforecast.forecast.cache;

import java.time.Instant;

/**
 * One memoized fetch result. {@code value} may be {@code null}: "the source has nothing"
 * is an answer worth caching too.
 */
public record CachedEntry(
    String key,
    Object value,
    Instant fetchedAt
) {}
