package com.indiaforecast.common.likelihood;

import com.indiaforecast.common.exception.InvalidConfigurationException;
import com.indiaforecast.common.model.Sector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables for {@link LikelihoodEngine}.
 *
 * @param steepness     slope of the logistic curve applied to the schedule gap
 * @param minSampleSize resolved forecasts a sector needs before confidence may be HIGH
 * @param outlookMargin schedule gap beyond which a prediction is LIKELY_EARLY or LATE_RISK
 * @param sectorPriors  accuracy rate assumed for a sector with no resolved history
 */
public record LikelihoodSettings(
    double steepness,
    int minSampleSize,
    double outlookMargin,
    Map<Sector, Double> sectorPriors
) {
    public static final double DEFAULT_STEEPNESS      = 5.0;
    public static final int    DEFAULT_MIN_SAMPLE     = 5;
    public static final double DEFAULT_OUTLOOK_MARGIN = 0.10;
    public static final double FALLBACK_PRIOR         = 0.6;

    public LikelihoodSettings {
        if (!(steepness > 0.0) || Double.isInfinite(steepness)) {
            throw new InvalidConfigurationException("forecast.likelihood.steepness", "must be positive, got " + steepness);
        }
        if (minSampleSize < 1) {
            throw new InvalidConfigurationException("forecast.likelihood.min-sample-size", "must be >= 1, got " + minSampleSize);
        }
        if (!(outlookMargin >= 0.0 && outlookMargin < 1.0)) {
            throw new InvalidConfigurationException("forecast.likelihood.outlook-margin", "must be in [0, 1), got " + outlookMargin);
        }
        Map<Sector, Double> priors = new EnumMap<>(defaultPriors());
        if (sectorPriors != null) {
            sectorPriors.forEach((sector, prior) -> {
                if (prior == null || prior < 0.0 || prior > 1.0) {
                    throw new InvalidConfigurationException("forecast.likelihood.sector-priors." + sector,
                        "must be in [0, 1], got " + prior);
                }
                priors.put(sector, prior);
            });
        }
        sectorPriors = Collections.unmodifiableMap(priors);
    }

    public static LikelihoodSettings defaults() {
        return new LikelihoodSettings(DEFAULT_STEEPNESS, DEFAULT_MIN_SAMPLE, DEFAULT_OUTLOOK_MARGIN, Map.of());
    }

    public double priorFor(Sector sector) {
        return sectorPriors.getOrDefault(sector, FALLBACK_PRIOR);
    }

    /** Long-run implementation track record per sector. */
    static Map<Sector, Double> defaultPriors() {
        Map<Sector, Double> priors = new EnumMap<>(Sector.class);
        priors.put(Sector.ECONOMY, 0.7);
        priors.put(Sector.ENERGY, 0.6);
        priors.put(Sector.INFRASTRUCTURE, 0.5);
        priors.put(Sector.TECHNOLOGY, 0.8);
        priors.put(Sector.AGRICULTURE, 0.6);
        priors.put(Sector.EDUCATION, 0.7);
        priors.put(Sector.HEALTHCARE, 0.6);
        priors.put(Sector.ENVIRONMENT, 0.5);
        priors.put(Sector.SOCIAL_DEVELOPMENT, 0.6);
        return priors;
    }
}
