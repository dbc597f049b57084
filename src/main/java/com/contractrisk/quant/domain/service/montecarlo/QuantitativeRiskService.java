package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.exception.NumericInstabilityException;
import com.contractrisk.quant.domain.exception.QuantRiskException;
import com.contractrisk.quant.domain.exception.RiskValidationException;
import com.contractrisk.quant.domain.exception.SimulationCancelledException;
import com.contractrisk.quant.domain.exception.UnsupportedDistributionException;
import com.contractrisk.quant.domain.exception.ValidationError;
import com.contractrisk.quant.domain.model.RiskSpec;
import com.contractrisk.quant.domain.model.SimulationResult;
import com.contractrisk.quant.domain.model.SimulationResult.PercentileRow;
import com.contractrisk.quant.domain.model.SimulationResult.SensitivityItem;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for one simulation: request checks, normalization, the sharded trial loop, then
 * statistics and sensitivity over the engine output. Distribution models arrive resolved; nothing
 * here consults the advisory service. The trial loop always runs on the simulation
 * pool; {@link #simulate(SimulationRequest)} only waits for it, up to the configured timeout.
 */
@Slf4j
@Service
public class QuantitativeRiskService {

    private final RiskInputNormalizer normalizer;
    private final SimulationEngine engine;
    private final StatisticsAggregator statisticsAggregator;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final MonteCarloProperties properties;
    private final MeterRegistry meterRegistry;
    private final Timer durationTimer;
    private final Counter cancelledCounter;

    public QuantitativeRiskService(RiskInputNormalizer normalizer,
                                   SimulationEngine engine,
                                   StatisticsAggregator statisticsAggregator,
                                   SensitivityAnalyzer sensitivityAnalyzer,
                                   MonteCarloProperties properties,
                                   MeterRegistry meterRegistry) {
        this.normalizer = normalizer;
        this.engine = engine;
        this.statisticsAggregator = statisticsAggregator;
        this.sensitivityAnalyzer = sensitivityAnalyzer;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.durationTimer = Timer.builder("quant.simulation.duration")
                .description("Wall time of one Monte Carlo run, normalization to result")
                .register(meterRegistry);
        this.cancelledCounter = Counter.builder("quant.simulation.cancelled")
                .description("Runs cancelled by timeout or interruption")
                .register(meterRegistry);
    }

    public SimulationResult simulate(SimulationRequest request) {
        return simulate(request, SimulationControl.none());
    }

    public SimulationResult simulate(SimulationRequest request, SimulationControl control) {
        CompletableFuture<SimulationResult> future = simulateAsync(request, control);
        try {
            return future.get(properties.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            control.cancel();
            future.cancel(true);
            cancelledCounter.increment();
            log.warn("[MC] 시뮬레이션 타임아웃, 취소 요청: timeout={}ms", properties.getTimeoutMs());
            throw new SimulationCancelledException(
                    "simulation exceeded " + properties.getTimeoutMs() + "ms and was cancelled", e);
        } catch (InterruptedException e) {
            control.cancel();
            future.cancel(true);
            cancelledCounter.increment();
            Thread.currentThread().interrupt();
            throw new SimulationCancelledException("simulation interrupted", e);
        } catch (ExecutionException e) {
            RuntimeException cause = SimulationEngine.unwrap(e);
            if (cause instanceof SimulationCancelledException) {
                cancelledCounter.increment();
            }
            throw cause;
        }
    }

    /**
     * Validation failures are thrown synchronously; everything after normalization completes the
     * returned future.
     */
    public CompletableFuture<SimulationResult> simulateAsync(SimulationRequest request, SimulationControl control) {
        long startNano = System.nanoTime();

        int iterations = request.getIterations() != null
                ? request.getIterations() : properties.getDefaultIterations();
        double targetPercentile = request.getTargetPercentile() != null
                ? request.getTargetPercentile() : properties.getDefaultTargetPercentile();

        List<RiskSpec> risks;
        try {
            validateRunParameters(request, iterations, targetPercentile);
            risks = normalizer.normalize(request.getRisks());
        } catch (QuantRiskException e) {
            countRejection(e);
            throw e;
        }

        boolean seedGenerated = request.getSeed() == null;
        long seed = seedGenerated ? new SplittableRandom().nextLong() : request.getSeed();

        CompletableFuture<SimulationSamples> loop;
        try {
            loop = engine.runAsync(risks, iterations, seed, control);
        } catch (SimulationCancelledException e) {
            cancelledCounter.increment();
            throw e;
        }

        return loop
                .thenApply(samples -> assemble(risks, samples, targetPercentile, seedGenerated, startNano))
                .whenComplete((result, error) -> {
                    if (error != null) {
                        RuntimeException cause = SimulationEngine.unwrap(error);
                        if (cause instanceof NumericInstabilityException) {
                            countRejection(cause);
                            log.error("[MC] 수치 불안정으로 시뮬레이션 중단: {}", cause.getMessage());
                        }
                    }
                });
    }

    private SimulationResult assemble(List<RiskSpec> risks, SimulationSamples samples,
                                      double targetPercentile, boolean seedGenerated, long startNano) {
        StatisticsSummary stats = statisticsAggregator.summarize(samples.getTotals(), targetPercentile);
        List<SensitivityItem> ranking = sensitivityAnalyzer.rank(samples.getContributions(), samples.getRiskIds());

        double base = 0.0;
        for (RiskSpec risk : risks) {
            base += risk.signedP50();
        }

        List<PercentileRow> percentileTable = new ArrayList<>(stats.getPercentileTable().size());
        for (StatisticsSummary.PercentilePoint point : stats.getPercentileTable()) {
            percentileTable.add(PercentileRow.builder()
                    .percentile(point.percentile())
                    .value(point.value())
                    .varianceFromBase(point.value() - base)
                    .build());
        }

        Map<String, RiskSpec> byId = risks.stream()
                .collect(Collectors.toMap(RiskSpec::getId, Function.identity()));
        List<SensitivityItem> labelled = ranking.stream()
                .map(item -> {
                    RiskSpec spec = byId.get(item.getRiskId());
                    return item.toBuilder()
                            .riskNumber(spec.getRiskNumber())
                            .title(spec.getTitle())
                            .build();
                })
                .toList();

        long elapsedNanos = System.nanoTime() - startNano;
        durationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);

        SimulationResult result = SimulationResult.builder()
                .base(base)
                .p10(stats.getP10())
                .p50(stats.getP50())
                .p90(stats.getP90())
                .mean(stats.getMean())
                .stdDev(stats.getStdDev())
                .targetPercentile(targetPercentile)
                .targetValue(stats.getTargetValue())
                .distribution(stats.getDistribution())
                .percentileTable(percentileTable)
                .sensitivityAnalysis(labelled)
                .iterations(samples.iterations())
                .riskCount(risks.size())
                .seed(samples.getSeed())
                .seedGenerated(seedGenerated)
                .shardCount(samples.getShardCount())
                .calcDurationMillis(elapsedNanos / 1_000_000)
                .timestamp(System.currentTimeMillis())
                .build();

        log.info("[MC] 시뮬레이션 완료: risks={}, iterations={}, seed={}{}, shards={}, base={}, p50={}, P{}={}, total={}ms",
                risks.size(), samples.iterations(), samples.getSeed(), seedGenerated ? "(generated)" : "",
                samples.getShardCount(), String.format("%.0f", base), String.format("%.0f", stats.getP50()),
                String.format("%.0f", targetPercentile), String.format("%.0f", stats.getTargetValue()),
                result.getCalcDurationMillis());

        return result;
    }

    private void validateRunParameters(SimulationRequest request, int iterations, double targetPercentile) {
        List<ValidationError> errors = new ArrayList<>();
        if (request.getRisks() == null || request.getRisks().isEmpty()) {
            errors.add(new ValidationError(null, "risks", "must contain at least one risk"));
        }
        if (iterations <= 0) {
            errors.add(new ValidationError(null, "iterations", "must be positive, got " + iterations));
        } else if (iterations > properties.getMaxIterations()) {
            errors.add(new ValidationError(null, "iterations",
                    "must not exceed " + properties.getMaxIterations() + ", got " + iterations));
        }
        if (!(targetPercentile >= 0.0 && targetPercentile <= 100.0)) {
            errors.add(new ValidationError(null, "targetPercentile",
                    "must be within [0, 100], got " + targetPercentile));
        }
        if (request.getRisks() != null && iterations > 0) {
            long cells = (long) iterations * request.getRisks().size();
            if (cells > properties.getMaxCells()) {
                errors.add(new ValidationError(null, "iterations",
                        "iterations x risks must not exceed " + properties.getMaxCells() + ", got "
                                + iterations + " x " + request.getRisks().size() + " = " + cells));
            }
        }
        if (!errors.isEmpty()) {
            log.warn("[MC] 시뮬레이션 요청 거부: errors={}", errors);
            throw new RiskValidationException(errors);
        }
    }

    private void countRejection(RuntimeException e) {
        String reason;
        if (e instanceof UnsupportedDistributionException) reason = "unsupported_distribution";
        else if (e instanceof RiskValidationException) reason = "validation";
        else if (e instanceof NumericInstabilityException) reason = "numeric_instability";
        else reason = "other";
        meterRegistry.counter("quant.simulation.rejected", "reason", reason).increment();
    }
}
