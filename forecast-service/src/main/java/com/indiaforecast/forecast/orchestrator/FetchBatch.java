package com.indiaforecast.forecast.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.Sector;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merged result of one orchestrated fetch. Every requested sector has an entry, possibly
 * empty; an empty list with no matching failure means the sources simply had no data.
 */
public record FetchBatch<T>(
    @JsonProperty("bySector") Map<Sector, List<T>> bySector,
    @JsonProperty("failures") List<FetchFailure> failures
) {
    public FetchBatch {
        Map<Sector, List<T>> copy = new EnumMap<>(Sector.class);
        bySector.forEach((sector, records) -> copy.put(sector, List.copyOf(records)));
        bySector = Collections.unmodifiableMap(copy);
        failures = List.copyOf(failures);
    }

    public static <T> FetchBatch<T> empty(Collection<Sector> sectors) {
        Map<Sector, List<T>> map = new EnumMap<>(Sector.class);
        sectors.forEach(s -> map.put(s, List.of()));
        return new FetchBatch<>(map, List.of());
    }

    public List<T> forSector(Sector sector) {
        return bySector.getOrDefault(sector, List.of());
    }

    @JsonIgnore
    public List<T> records() {
        return bySector.values().stream().flatMap(List::stream).toList();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
