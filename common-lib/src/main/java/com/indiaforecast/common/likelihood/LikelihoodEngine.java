package com.indiaforecast.common.likelihood;

import com.indiaforecast.common.classification.HistoricalAccuracyStats;
import com.indiaforecast.common.classification.SectorAccuracy;
import com.indiaforecast.common.model.ConfidenceLevel;
import com.indiaforecast.common.model.LikelihoodAssessment;
import com.indiaforecast.common.model.LikelihoodOutlook;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SectorOutlook;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Estimates how likely an unresolved target is to be met.
 *
 * <h3>Model</h3>
 * <pre>
 *   progressRatio = currentProgress / targetValue
 *   timeRatio     = clamp((currentYear - announcementYear) / (targetYear - announcementYear), 0, 1)
 *   gap           = progressRatio - timeRatio
 *   baseline      = 1 / (1 + exp(-steepness * gap))
 *   probability   = clamp(baseline * (0.5 + 0.5 * sectorAccuracyRate), 0, 1)
 * </pre>
 *
 * <h3>Confidence</h3>
 * <pre>
 *   p &gt; 0.8 and sample &gt;= minSampleSize        → HIGH
 *   0.6 &lt;= p &lt;= 0.8, or p &gt; 0.6 on a small sample → MEDIUM
 *   otherwise                                     → LOW
 * </pre>
 *
 * <h3>Sector summary</h3>
 * <pre>
 *   score           = mean(LIKELY_EARLY → +1, ON_TIME → 0, LATE_RISK → -1)
 *   outlook         = score &gt; 0.3 → LIKELY_EARLY, score &lt; -0.3 → LATE_RISK, else ON_TIME
 *   confidenceScore = min(1, mean(probability) + 0.1 · min(1, n / 5) + 0.1 · max(0, 1 - horizon / 20))
 * </pre>
 *
 * <p>The current year comes from the injected {@link Clock}, so identical inputs and clock
 * always give identical assessments.
 */
public class LikelihoodEngine {

    private static final double HIGH_THRESHOLD   = 0.8;
    private static final double MEDIUM_THRESHOLD = 0.6;
    private static final int    MAX_RATIONALE    = 3;
    private static final double SECTOR_CUTOFF    = 0.3;
    private static final double FULL_COUNT       = 5.0;
    private static final double HORIZON_YEARS    = 20.0;
    private static final double FACTOR_WEIGHT    = 0.1;

    private final LikelihoodSettings settings;
    private final Clock clock;

    public LikelihoodEngine(LikelihoodSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock    = Objects.requireNonNull(clock, "clock");
    }

    public LikelihoodAssessment analyze(Prediction prediction, HistoricalAccuracyStats historicalStats) {
        Objects.requireNonNull(prediction, "prediction");
        HistoricalAccuracyStats stats = historicalStats == null ? HistoricalAccuracyStats.empty() : historicalStats;

        int currentYear      = LocalDate.now(clock).getYear();
        double progressRatio = progressRatio(prediction);
        double timeRatio     = timeRatio(prediction.announcementYear(), prediction.targetYear(), currentYear);
        double gap           = progressRatio - timeRatio;

        SectorAccuracy history = stats.forSector(prediction.sector());
        double accuracyRate    = history.hasHistory() ? history.accuracyRate() : settings.priorFor(prediction.sector());

        double probability = adjustedProbability(baselineProbability(gap, settings.steepness()), accuracyRate);
        ConfidenceLevel confidence = confidence(probability, history.sampleSize(), settings.minSampleSize());
        LikelihoodOutlook outlook  = outlook(gap, settings.outlookMargin());

        List<String> rationale = rationale(prediction, progressRatio, timeRatio, history, accuracyRate,
            probability, currentYear);

        return new LikelihoodAssessment(prediction, probability, confidence, outlook,
            progressRatio, timeRatio, rationale);
    }

    public List<LikelihoodAssessment> analyzeAll(Collection<Prediction> predictions, HistoricalAccuracyStats stats) {
        List<LikelihoodAssessment> out = new ArrayList<>(predictions.size());
        for (Prediction prediction : predictions) {
            out.add(analyze(prediction, stats));
        }
        return out;
    }

    public static Map<LikelihoodOutlook, Integer> outlookCounts(Collection<LikelihoodAssessment> assessments) {
        Map<LikelihoodOutlook, Integer> counts = new EnumMap<>(LikelihoodOutlook.class);
        for (LikelihoodOutlook outlook : LikelihoodOutlook.values()) {
            counts.put(outlook, 0);
        }
        assessments.forEach(a -> counts.merge(a.outlook(), 1, Integer::sum));
        return counts;
    }

    /** Rolls one sector's assessments, all aimed at {@code targetYear}, into a single verdict. */
    public SectorOutlook summarize(Sector sector, Collection<LikelihoodAssessment> assessments, int targetYear) {
        if (assessments.isEmpty()) {
            return new SectorOutlook(sector, LikelihoodOutlook.ON_TIME, 0.0, 0);
        }
        double score = 0.0;
        double probabilitySum = 0.0;
        for (LikelihoodAssessment a : assessments) {
            score += switch (a.outlook()) {
                case LIKELY_EARLY -> 1.0;
                case ON_TIME      -> 0.0;
                case LATE_RISK    -> -1.0;
            };
            probabilitySum += a.probability();
        }
        int n = assessments.size();
        double mean = score / n;
        LikelihoodOutlook outlook = mean > SECTOR_CUTOFF ? LikelihoodOutlook.LIKELY_EARLY
            : mean < -SECTOR_CUTOFF ? LikelihoodOutlook.LATE_RISK
            : LikelihoodOutlook.ON_TIME;

        int horizon = Math.max(0, targetYear - LocalDate.now(clock).getYear());
        double countFactor   = Math.min(1.0, n / FULL_COUNT) * FACTOR_WEIGHT;
        double horizonFactor = Math.max(0.0, 1.0 - horizon / HORIZON_YEARS) * FACTOR_WEIGHT;
        double confidenceScore = clamp(probabilitySum / n + countFactor + horizonFactor);
        return new SectorOutlook(sector, outlook, confidenceScore, n);
    }

    // ── model steps ─────────────────────────────────────────────────────────

    static double progressRatio(Prediction prediction) {
        return prediction.currentProgress().value() / prediction.targetValue().value();
    }

    static double timeRatio(int announcementYear, int targetYear, int currentYear) {
        int span = targetYear - announcementYear;
        if (span <= 0) {
            return 1.0;
        }
        return clamp((double) (currentYear - announcementYear) / span);
    }

    /** Strictly increasing in {@code gap}; 0.5 when progress is exactly on the linear schedule. */
    static double baselineProbability(double gap, double steepness) {
        return 1.0 / (1.0 + Math.exp(-steepness * gap));
    }

    static double adjustedProbability(double baseline, double accuracyRate) {
        return clamp(baseline * (0.5 + 0.5 * accuracyRate));
    }

    static ConfidenceLevel confidence(double probability, int sampleSize, int minSampleSize) {
        boolean enoughHistory = sampleSize >= minSampleSize;
        if (probability > HIGH_THRESHOLD && enoughHistory) {
            return ConfidenceLevel.HIGH;
        }
        // above 0.8 on a small sample lands here too
        if (probability >= MEDIUM_THRESHOLD) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    static LikelihoodOutlook outlook(double gap, double margin) {
        if (gap >= margin) {
            return LikelihoodOutlook.LIKELY_EARLY;
        }
        if (Math.abs(gap) < margin) {
            return LikelihoodOutlook.ON_TIME;
        }
        return LikelihoodOutlook.LATE_RISK;
    }

    // ── rationale ───────────────────────────────────────────────────────────

    private record Factor(double strength, String text) {}

    private List<String> rationale(Prediction prediction, double progressRatio, double timeRatio,
                                   SectorAccuracy history, double accuracyRate,
                                   double probability, int currentYear) {
        List<Factor> factors = new ArrayList<>();
        String sectorName = prediction.sector().displayName();

        double gap = progressRatio - timeRatio;
        factors.add(new Factor(Math.abs(gap), String.format(Locale.ROOT,
            "progress %s %s linear schedule (%s achieved vs %s of time elapsed)",
            percent(Math.abs(gap)), gap >= 0 ? "ahead of" : "behind",
            percent(progressRatio), percent(timeRatio))));

        if (history.hasHistory()) {
            factors.add(new Factor(Math.abs(accuracyRate - 0.5), String.format(Locale.ROOT,
                "%s sector historically accurate %s of the time (n=%d)",
                sectorName, percent(accuracyRate), history.sampleSize())));
        } else {
            factors.add(new Factor(Math.abs(accuracyRate - 0.5), String.format(Locale.ROOT,
                "no resolved %s forecasts; sector prior of %s applied",
                sectorName, percent(accuracyRate))));
        }

        if (history.sampleSize() < settings.minSampleSize()) {
            double shortfall = (double) (settings.minSampleSize() - history.sampleSize()) / settings.minSampleSize();
            double strength  = probability > HIGH_THRESHOLD ? 1.0 : 0.3 * shortfall;
            factors.add(new Factor(strength, String.format(Locale.ROOT,
                "only %d resolved %s forecasts (minimum %d); confidence capped below HIGH",
                history.sampleSize(), sectorName, settings.minSampleSize())));
        }

        int yearsRemaining = prediction.targetYear() - currentYear;
        if (yearsRemaining > 0) {
            factors.add(new Factor(0.2 * Math.min(1.0, yearsRemaining / 20.0), String.format(Locale.ROOT,
                "%d years remaining until %d", yearsRemaining, prediction.targetYear())));
        } else {
            factors.add(new Factor(0.5, String.format(Locale.ROOT,
                "target year %d reached with %s of target achieved", prediction.targetYear(), percent(progressRatio))));
        }

        factors.sort(Comparator.comparingDouble(Factor::strength).reversed());
        return factors.stream()
            .limit(MAX_RATIONALE)
            .map(Factor::text)
            .toList();
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f%%", ratio * 100.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
