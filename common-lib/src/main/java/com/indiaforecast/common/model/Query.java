package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Logical fetch request: which sectors, from which sources, over which years.
 * Only used to derive cache keys, so collections are copied into sorted enum sets.
 */
public record Query(
    @JsonProperty("sectors")  Set<Sector> sectors,
    @JsonProperty("sources")  Set<SourceId> sources,
    @JsonProperty("fromYear") int fromYear,
    @JsonProperty("toYear")   int toYear
) {
    public Query {
        sectors = sectors == null || sectors.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(sectors));
        sources = sources == null || sources.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(sources));
        if (toYear < fromYear) {
            throw new IllegalArgumentException("toYear " + toYear + " is before fromYear " + fromYear);
        }
    }

    public static Query of(Set<Sector> sectors, Set<SourceId> sources, int fromYear, int toYear) {
        return new Query(sectors, sources, fromYear, toYear);
    }

    public static Query single(Sector sector, SourceId source, int fromYear, int toYear) {
        return new Query(
            sector == null ? Set.of() : Set.of(sector),
            source == null ? Set.of() : Set.of(source),
            fromYear, toYear);
    }

    public boolean singleYear() {
        return fromYear == toYear;
    }
}
