package com.indiaforecast.common.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.ClassificationResult;
import com.indiaforecast.common.model.ClassificationStatus;
import com.indiaforecast.common.model.Sector;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-sector accuracy of past forecasts, as consumed by the likelihood engine.
 * Immutable once built.
 */
public final class HistoricalAccuracyStats {

    private final Map<Sector, SectorAccuracy> bySector;
    private final Map<ClassificationStatus, Integer> statusCounts;

    private HistoricalAccuracyStats(Map<Sector, SectorAccuracy> bySector,
                                    Map<ClassificationStatus, Integer> statusCounts) {
        this.bySector     = Collections.unmodifiableMap(bySector);
        this.statusCounts = Collections.unmodifiableMap(statusCounts);
    }

    public static HistoricalAccuracyStats empty() {
        return of(List.of());
    }

    public static HistoricalAccuracyStats of(Collection<ClassificationResult> results) {
        Map<Sector, int[]> counts = new EnumMap<>(Sector.class);
        Map<Sector, Double> deviationSums = new EnumMap<>(Sector.class);
        Map<ClassificationStatus, Integer> overall = new EnumMap<>(ClassificationStatus.class);
        for (ClassificationStatus status : ClassificationStatus.values()) {
            overall.put(status, 0);
        }

        for (ClassificationResult result : results) {
            Sector sector = result.forecast().sector();
            int[] c = counts.computeIfAbsent(sector, s -> new int[ClassificationStatus.values().length]);
            c[result.status().ordinal()]++;
            overall.merge(result.status(), 1, Integer::sum);
            if (result.deviationRatio() != null) {
                deviationSums.merge(sector, Math.abs(result.deviationRatio()), Double::sum);
            }
        }

        Map<Sector, SectorAccuracy> bySector = new EnumMap<>(Sector.class);
        counts.forEach((sector, c) -> {
            int early      = c[ClassificationStatus.EARLY.ordinal()];
            int onTime     = c[ClassificationStatus.ON_TIME.ordinal()];
            int late       = c[ClassificationStatus.LATE.ordinal()];
            int unresolved = c[ClassificationStatus.UNRESOLVED.ordinal()];
            int resolved   = early + onTime + late;
            double rate = resolved == 0 ? 0.0 : (double) (early + onTime) / resolved;
            double mad  = resolved == 0 ? 0.0 : deviationSums.getOrDefault(sector, 0.0) / resolved;
            bySector.put(sector, new SectorAccuracy(sector, resolved, early, onTime, late, unresolved, rate, mad));
        });
        return new HistoricalAccuracyStats(bySector, overall);
    }

    public SectorAccuracy forSector(Sector sector) {
        return bySector.getOrDefault(sector, SectorAccuracy.empty(sector));
    }

    @JsonProperty("bySector")
    public Map<Sector, SectorAccuracy> bySector() {
        return bySector;
    }

    @JsonProperty("statusCounts")
    public Map<ClassificationStatus, Integer> statusCounts() {
        return statusCounts;
    }

    @JsonProperty("totalResolved")
    public int totalResolved() {
        return bySector.values().stream().mapToInt(SectorAccuracy::sampleSize).sum();
    }
}
