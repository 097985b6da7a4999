package com.indiaforecast.common.model;

/**
 * Fixed ranking of source categories. A higher {@link #rank()} wins when several
 * actuals match the same forecast.
 */
public enum TrustTier {
    NEWS_ARCHIVE(1),
    INTERNATIONAL_AGENCY(2),
    GOVERNMENT_PRIMARY(3);

    private final int rank;

    TrustTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
