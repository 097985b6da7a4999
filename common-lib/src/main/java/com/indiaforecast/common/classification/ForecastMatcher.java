package com.indiaforecast.common.classification;

import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ForecastRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Pairs a forecast with the actual it should be judged against.
 *
 * <p>A forecast and an actual are matchable iff they share the sector, the normalised
 * metric name and the unit, and {@code actual.year == forecast.targetYear}. Among several
 * matchable actuals the highest trust tier wins; within a tier the earlier-declared
 * {@link com.indiaforecast.common.model.SourceId} wins. The order is total, so the
 * choice never depends on input ordering.
 *
 * <p>Stateless. No logging.
 */
public final class ForecastMatcher {

    static final Comparator<ActualRecord> PREFERENCE = Comparator
        .comparing((ActualRecord a) -> a.source().trustTier().rank()).reversed()
        .thenComparing(a -> a.source().ordinal());

    private ForecastMatcher() {}

    public static boolean matchable(ForecastRecord forecast, ActualRecord actual) {
        return forecast.sector() == actual.sector()
            && actual.year() == forecast.targetYear()
            && forecast.predictedValue().sameUnitAs(actual.actualValue())
            && MetricNames.same(forecast.metric(), actual.metric());
    }

    public static Optional<ActualRecord> bestMatch(ForecastRecord forecast, Collection<ActualRecord> actuals) {
        if (actuals == null || actuals.isEmpty()) {
            return Optional.empty();
        }
        return actuals.stream()
            .filter(actual -> matchable(forecast, actual))
            .min(PREFERENCE);
    }
}
