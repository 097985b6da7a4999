package com.indiaforecast.common.classification;

import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ClassificationResult;
import com.indiaforecast.common.model.ClassificationStatus;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Measurement;
import com.indiaforecast.common.model.ToleranceBand;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Compares forecasts with realised actuals.
 *
 * <p>Status rules, for {@code d = (actual - predicted) / predicted} and band threshold {@code t}:
 * <ol>
 *   <li>no matched actual      → {@link ClassificationStatus#UNRESOLVED}</li>
 *   <li>{@code |d| <= t}       → {@link ClassificationStatus#ON_TIME} (boundary inclusive)</li>
 *   <li>{@code d > t}          → {@link ClassificationStatus#EARLY}</li>
 *   <li>otherwise              → {@link ClassificationStatus#LATE}</li>
 * </ol>
 *
 * <p>The status is a pure function of {@code (d, t)}. No reactive types, no logging,
 * no clock.
 */
public class ClassificationEngine {

    /** Absorbs floating-point noise so a ratio computed to exactly the threshold stays ON_TIME. */
    static final double BOUNDARY_EPSILON = 1e-9;

    private final ToleranceBands bands;

    public ClassificationEngine(ToleranceBands bands) {
        this.bands = Objects.requireNonNull(bands, "bands");
    }

    public ToleranceBands bands() {
        return bands;
    }

    /**
     * @param forecast the forecast under evaluation
     * @param actual   its matched actual, or {@code null} when no outcome was found
     * @param band     tolerance band to apply
     * @throws IllegalArgumentException when the predicted value is zero or the units differ
     */
    public ClassificationResult classify(ForecastRecord forecast, ActualRecord actual, ToleranceBand band) {
        Objects.requireNonNull(forecast, "forecast");
        Objects.requireNonNull(band, "band");
        if (actual == null) {
            return ClassificationResult.unresolved(forecast, band);
        }
        double ratio = deviationRatio(forecast.predictedValue(), actual.actualValue());
        ClassificationStatus status = resolveStatus(ratio, bands.threshold(band));
        return new ClassificationResult(forecast, actual, status, ratio, band);
    }

    /**
     * Classifies a qualitative milestone by the year it was achieved. Earlier achievement
     * yields a positive ratio, scaled by the forecast horizon, and therefore EARLY.
     *
     * @param achievedYear year the milestone was met, or {@code null} if it has not been
     */
    public ClassificationResult classifyMilestone(ForecastRecord forecast, Integer achievedYear, ToleranceBand band) {
        Objects.requireNonNull(forecast, "forecast");
        Objects.requireNonNull(band, "band");
        if (achievedYear == null) {
            return ClassificationResult.unresolved(forecast, band);
        }
        int horizon  = Math.max(1, forecast.targetYear() - forecast.forecastYear());
        double ratio = (double) (forecast.targetYear() - achievedYear) / horizon;
        ActualRecord achieved = new ActualRecord(
            forecast.metric(),
            Measurement.of(achievedYear, "year"),
            forecast.sector(),
            achievedYear,
            forecast.source(),
            forecast.provenanceUrl());
        return new ClassificationResult(forecast, achieved, resolveStatus(ratio, bands.threshold(band)), ratio, band);
    }

    /**
     * Matches every forecast against {@code actuals} and classifies it. Forecasts are
     * never dropped; unmatched ones come back UNRESOLVED. Output order follows input order.
     */
    public List<ClassificationResult> classifyAll(Collection<ForecastRecord> forecasts,
                                                  Collection<ActualRecord> actuals,
                                                  ToleranceBand band) {
        List<ClassificationResult> results = new ArrayList<>(forecasts.size());
        for (ForecastRecord forecast : forecasts) {
            ActualRecord match = ForecastMatcher.bestMatch(forecast, actuals).orElse(null);
            results.add(classify(forecast, match, band));
        }
        return results;
    }

    // ── pure helpers ─────────────────────────────────────────────────────────

    static double deviationRatio(Measurement predicted, Measurement actual) {
        if (!predicted.sameUnitAs(actual)) {
            throw new IllegalArgumentException("Unit mismatch: predicted '" + predicted.unit()
                + "' vs actual '" + actual.unit() + "'");
        }
        if (predicted.value() == 0.0) {
            throw new IllegalArgumentException("Predicted value must be non-zero");
        }
        return (actual.value() - predicted.value()) / predicted.value();
    }

    static ClassificationStatus resolveStatus(double deviationRatio, double threshold) {
        if (Math.abs(deviationRatio) <= threshold + BOUNDARY_EPSILON) {
            return ClassificationStatus.ON_TIME;
        }
        return deviationRatio > 0 ? ClassificationStatus.EARLY : ClassificationStatus.LATE;
    }
}
