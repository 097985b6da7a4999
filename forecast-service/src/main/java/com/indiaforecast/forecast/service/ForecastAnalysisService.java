package com.indiaforecast.forecast.service;

import com.indiaforecast.common.classification.ClassificationEngine;
import com.indiaforecast.common.classification.HistoricalAccuracyStats;
import com.indiaforecast.common.likelihood.LikelihoodEngine;
import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ClassificationResult;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.LikelihoodAssessment;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SectorOutlook;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.common.model.ToleranceBand;
import com.indiaforecast.forecast.config.CalibrationSettings;
import com.indiaforecast.forecast.config.CalibrationWindow;
import com.indiaforecast.forecast.orchestrator.FetchBatch;
import com.indiaforecast.forecast.orchestrator.FetchFailure;
import com.indiaforecast.forecast.orchestrator.FetchOrchestrator;
import com.indiaforecast.forecast.registry.FetchCapability;
import com.indiaforecast.forecast.registry.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The two user-facing analyses:
 * <ul>
 *   <li>accuracy: how past forecasts for a target year turned out;</li>
 *   <li>likelihood: how open targets are tracking, weighted by how accurate each sector's
 *       forecasts have been over the configured calibration windows.</li>
 * </ul>
 */
@Service
public class ForecastAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ForecastAnalysisService.class);

    private final FetchOrchestrator orchestrator;
    private final ClassificationEngine classificationEngine;
    private final LikelihoodEngine likelihoodEngine;
    private final SourceRegistry registry;
    private final List<CalibrationWindow> calibrationWindows;

    public ForecastAnalysisService(FetchOrchestrator orchestrator, ClassificationEngine classificationEngine,
                                   LikelihoodEngine likelihoodEngine, SourceRegistry registry,
                                   CalibrationSettings calibration) {
        this.orchestrator         = orchestrator;
        this.classificationEngine = classificationEngine;
        this.likelihoodEngine     = likelihoodEngine;
        this.registry             = registry;
        this.calibrationWindows   = calibration.windows();
    }

    public Mono<AccuracyReport> evaluateForecasts(int forecastYear, int targetYear, Collection<Sector> sectors,
                                                  Collection<SourceId> sources, ToleranceBand band) {
        if (targetYear < forecastYear) {
            return Mono.error(new IllegalArgumentException(
                "targetYear " + targetYear + " precedes forecastYear " + forecastYear));
        }
        return Mono.zip(
                orchestrator.fetchHistoricalForecasts(forecastYear, targetYear, sectors, sources),
                orchestrator.fetchActualOutcomes(targetYear, sectors))
            .map(t -> classify(forecastYear, targetYear, band, t.getT1(), t.getT2()));
    }

    /** Replays every calibration window against the sources that publish forecasts. */
    public Mono<HistoricalAccuracyStats> calibrate(Collection<Sector> sectors, ToleranceBand band) {
        List<SourceId> historicalSources = registry.withCapability(FetchCapability.HISTORICAL);
        return Flux.fromIterable(calibrationWindows)
            .concatMap(w -> evaluateForecasts(w.forecastYear(), w.targetYear(), sectors, historicalSources, band))
            .collectList()
            .map(reports -> {
                List<ClassificationResult> all = new ArrayList<>();
                int failures = 0;
                for (AccuracyReport report : reports) {
                    all.addAll(report.allResults());
                    failures += report.failures().size();
                }
                HistoricalAccuracyStats stats = HistoricalAccuracyStats.of(all);
                log.info("Calibration complete. windows={} results={} resolved={} failures={}",
                    reports.size(), all.size(), stats.totalResolved(), failures);
                return stats;
            });
    }

    public Mono<LikelihoodReport> assessLikelihood(int targetYear, Collection<Sector> sectors,
                                                   Collection<SourceId> sources, ToleranceBand band) {
        return Mono.zip(
                calibrate(sectors, band),
                orchestrator.fetchCurrentPredictions(targetYear, sectors, sources))
            .map(t -> {
                HistoricalAccuracyStats history = t.getT1();
                FetchBatch<Prediction> predictions = t.getT2();

                Map<Sector, List<LikelihoodAssessment>> bySector = new EnumMap<>(Sector.class);
                Map<Sector, SectorOutlook> sectorOutlooks = new EnumMap<>(Sector.class);
                predictions.bySector().forEach((sector, preds) -> {
                    List<LikelihoodAssessment> assessed = likelihoodEngine.analyzeAll(preds, history);
                    bySector.put(sector, assessed);
                    sectorOutlooks.put(sector, likelihoodEngine.summarize(sector, assessed, targetYear));
                });

                List<LikelihoodAssessment> all = bySector.values().stream().flatMap(List::stream).toList();
                log.info("Likelihood assessed. targetYear={} predictions={} failures={}",
                    targetYear, all.size(), predictions.failures().size());
                return new LikelihoodReport(targetYear, bySector, LikelihoodEngine.outlookCounts(all),
                    sectorOutlooks, history, predictions.failures());
            });
    }

    /** Year series of actuals and open targets per sector, for trend comparison. */
    public Mono<TrendReport> trend(int fromYear, int toYear, int step, Collection<Sector> sectors) {
        return orchestrator.fetchTrend(fromYear, toYear, step, sectors)
            .map(batch -> new TrendReport(fromYear, toYear, step, batch.bySector(), batch.failures()));
    }

    // ── classification ──────────────────────────────────────────────────────

    private AccuracyReport classify(int forecastYear, int targetYear, ToleranceBand band,
                                    FetchBatch<ForecastRecord> forecasts, FetchBatch<ActualRecord> actuals) {
        Map<Sector, List<ClassificationResult>> results = new EnumMap<>(Sector.class);
        forecasts.bySector().forEach((sector, records) -> {
            List<ForecastRecord> usable = records.stream()
                .filter(ForecastAnalysisService::usable)
                .toList();
            results.put(sector, classificationEngine.classifyAll(usable, actuals.forSector(sector), band));
        });

        List<ClassificationResult> all = results.values().stream().flatMap(List::stream).toList();
        List<FetchFailure> failures = new ArrayList<>(forecasts.failures());
        failures.addAll(actuals.failures());

        HistoricalAccuracyStats stats = HistoricalAccuracyStats.of(all);
        log.info("Forecasts classified. forecastYear={} targetYear={} band={} results={} statusCounts={}",
            forecastYear, targetYear, band, all.size(), stats.statusCounts());
        return new AccuracyReport(forecastYear, targetYear, band, results, stats, failures);
    }

    private static boolean usable(ForecastRecord forecast) {
        if (forecast.predictedValue().value() == 0.0) {
            log.warn("Dropping forecast with zero predicted value. metric={} source={} year={}",
                forecast.metric(), forecast.source(), forecast.forecastYear());
            return false;
        }
        return true;
    }
}
