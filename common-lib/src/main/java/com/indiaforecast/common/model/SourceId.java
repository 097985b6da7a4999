package com.indiaforecast.common.model;

/**
 * Known data sources. Declaration order is the tie-breaker between sources of the
 * same {@link TrustTier}.
 */
public enum SourceId {
    RBI("RBI", TrustTier.GOVERNMENT_PRIMARY),
    MOSPI("MoSPI", TrustTier.GOVERNMENT_PRIMARY),
    NITI_AAYOG("NITI Aayog", TrustTier.GOVERNMENT_PRIMARY),
    PIB("PIB", TrustTier.GOVERNMENT_PRIMARY),
    PLANNING_COMMISSION("Planning Commission", TrustTier.GOVERNMENT_PRIMARY),
    IEA("IEA", TrustTier.INTERNATIONAL_AGENCY),
    UN_DESA("UN DESA", TrustTier.INTERNATIONAL_AGENCY),
    WORLD_BANK("World Bank", TrustTier.INTERNATIONAL_AGENCY),
    REUTERS("Reuters", TrustTier.NEWS_ARCHIVE),
    THE_HINDU("The Hindu", TrustTier.NEWS_ARCHIVE),
    ECONOMIC_TIMES("Economic Times", TrustTier.NEWS_ARCHIVE),
    MINT("Mint", TrustTier.NEWS_ARCHIVE);

    private final String displayName;
    private final TrustTier trustTier;

    SourceId(String displayName, TrustTier trustTier) {
        this.displayName = displayName;
        this.trustTier   = trustTier;
    }

    public String displayName() {
        return displayName;
    }

    public TrustTier trustTier() {
        return trustTier;
    }

    /**
     * Resolves the constant name or display name, ignoring case.
     *
     * @throws IllegalArgumentException when nothing matches
     */
    public static SourceId fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Source label must not be null");
        }
        String trimmed = label.trim();
        for (SourceId source : values()) {
            if (source.name().equalsIgnoreCase(trimmed) || source.displayName.equalsIgnoreCase(trimmed)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + label);
    }
}
