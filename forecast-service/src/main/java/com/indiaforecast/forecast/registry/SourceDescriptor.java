package com.indiaforecast.forecast.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.common.model.TrustTier;

import java.util.EnumSet;
import java.util.Set;

/**
 * Catalog entry for one source.
 *
 * @param homeUrl  public landing page, used as provenance when nothing more specific exists
 * @param endpoint API root or feed URL the fetcher calls; {@code null} for offline catalogs
 */
public record SourceDescriptor(
    @JsonProperty("id")           SourceId id,
    @JsonProperty("displayName")  String displayName,
    @JsonProperty("trustTier")    TrustTier trustTier,
    @JsonProperty("homeUrl")      String homeUrl,
    @JsonProperty("endpoint")     String endpoint,
    @JsonProperty("capabilities") Set<FetchCapability> capabilities
) {
    public SourceDescriptor {
        capabilities = capabilities == null || capabilities.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    static SourceDescriptor of(SourceId id, String homeUrl, String endpoint, FetchCapability... capabilities) {
        Set<FetchCapability> caps = EnumSet.noneOf(FetchCapability.class);
        caps.addAll(java.util.Arrays.asList(capabilities));
        return new SourceDescriptor(id, id.displayName(), id.trustTier(), homeUrl, endpoint, caps);
    }

    public boolean supports(FetchCapability capability) {
        return capabilities.contains(capability);
    }

    public SourceDescriptor withEndpoint(String newEndpoint) {
        return new SourceDescriptor(id, displayName, trustTier, homeUrl, newEndpoint, capabilities);
    }
}
