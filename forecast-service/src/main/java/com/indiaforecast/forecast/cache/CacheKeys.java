package com.indiaforecast.forecast.cache;

import com.indiaforecast.common.model.Query;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Derives cache keys such as {@code historical|ECONOMY,ENERGY|PLANNING_COMMISSION|1975-2000}.
 * Sectors and sources are sorted, so the key does not depend on request order.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String derive(String operation, Query query) {
        return operation
            + '|' + joinSorted(query.sectors())
            + '|' + joinSorted(query.sources())
            + '|' + query.fromYear() + '-' + query.toYear();
    }

    private static String joinSorted(Collection<? extends Enum<?>> values) {
        return values.stream()
            .map(Enum::name)
            .sorted()
            .collect(Collectors.joining(","));
    }
}
