package com.indiaforecast.forecast.registry;

import com.indiaforecast.common.model.SourceId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.indiaforecast.forecast.registry.FetchCapability.ACTUALS;
import static com.indiaforecast.forecast.registry.FetchCapability.CURRENT;
import static com.indiaforecast.forecast.registry.FetchCapability.HISTORICAL;

/**
 * Static catalog of every known {@link SourceId}: endpoints, trust tier and which fetch
 * operations the source can serve. Read-only after construction.
 *
 * <p>Capabilities describe what the source publishes. Whether a fetcher is actually wired
 * for it is decided by {@link com.indiaforecast.forecast.fetcher.SourceFetchers}.
 */
public final class SourceRegistry {

    private final Map<SourceId, SourceDescriptor> descriptors;

    private SourceRegistry(Map<SourceId, SourceDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new EnumMap<>(descriptors));
    }

    public static SourceRegistry defaults() {
        return withEndpoints(Map.of());
    }

    /**
     * Default catalog with selected endpoints replaced, e.g. to point a feed at a mirror.
     * Blank overrides are ignored.
     */
    public static SourceRegistry withEndpoints(Map<SourceId, String> endpointOverrides) {
        Map<SourceId, SourceDescriptor> map = new EnumMap<>(SourceId.class);
        for (SourceDescriptor d : defaultCatalog()) {
            String override = endpointOverrides.get(d.id());
            map.put(d.id(), override == null || override.isBlank() ? d : d.withEndpoint(override));
        }
        return new SourceRegistry(map);
    }

    public SourceDescriptor descriptor(SourceId id) {
        SourceDescriptor d = descriptors.get(id);
        if (d == null) {
            throw new IllegalArgumentException("Source not registered: " + id);
        }
        return d;
    }

    public Optional<String> endpoint(SourceId id) {
        return Optional.ofNullable(descriptor(id).endpoint());
    }

    public boolean supports(SourceId id, FetchCapability capability) {
        SourceDescriptor d = descriptors.get(id);
        return d != null && d.supports(capability);
    }

    public List<SourceDescriptor> all() {
        return List.copyOf(descriptors.values());
    }

    public List<SourceId> withCapability(FetchCapability capability) {
        return descriptors.values().stream()
            .filter(d -> d.supports(capability))
            .map(SourceDescriptor::id)
            .toList();
    }

    private static List<SourceDescriptor> defaultCatalog() {
        return List.of(
            SourceDescriptor.of(SourceId.RBI, "https://www.rbi.org.in",
                "https://www.rbi.org.in/scripts/rss.aspx", HISTORICAL, CURRENT),
            SourceDescriptor.of(SourceId.MOSPI, "https://www.mospi.gov.in",
                "https://www.mospi.gov.in/web/mospi/download-tables-data", ACTUALS),
            SourceDescriptor.of(SourceId.NITI_AAYOG, "https://www.niti.gov.in",
                "https://www.niti.gov.in/documents-reports", HISTORICAL, CURRENT),
            SourceDescriptor.of(SourceId.PIB, "https://pib.gov.in",
                null, CURRENT),
            SourceDescriptor.of(SourceId.PLANNING_COMMISSION, "https://niti.gov.in/planningcommission.gov.in",
                null, HISTORICAL),
            SourceDescriptor.of(SourceId.IEA, "https://www.iea.org",
                null, HISTORICAL, CURRENT),
            SourceDescriptor.of(SourceId.UN_DESA, "https://www.un.org/development/desa",
                null, HISTORICAL),
            SourceDescriptor.of(SourceId.WORLD_BANK, "https://data.worldbank.org",
                "https://api.worldbank.org/v2/country/IND/indicator", ACTUALS),
            SourceDescriptor.of(SourceId.REUTERS, "https://www.reuters.com",
                null, CURRENT),
            SourceDescriptor.of(SourceId.THE_HINDU, "https://www.thehindu.com",
                "https://www.thehindu.com/news/national/feeder/default.rss", HISTORICAL, CURRENT),
            SourceDescriptor.of(SourceId.ECONOMIC_TIMES, "https://economictimes.indiatimes.com",
                "https://economictimes.indiatimes.com/rssfeedstopstories.cms", HISTORICAL, CURRENT),
            SourceDescriptor.of(SourceId.MINT, "https://www.livemint.com",
                null, CURRENT)
        );
    }
}
