package com.indiaforecast.common.classification;

import java.util.Locale;

/** Canonical form of metric names used for forecast/actual matching. */
public final class MetricNames {

    private MetricNames() {}

    /**
     * Lower-cases, folds every non-alphanumeric run to a single space and trims.
     * {@code "GDP Growth-Rate "} and {@code "gdp growth rate"} normalise identically.
     */
    public static String normalize(String metric) {
        if (metric == null) {
            return "";
        }
        return metric.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", " ")
            .trim();
    }

    public static boolean same(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
