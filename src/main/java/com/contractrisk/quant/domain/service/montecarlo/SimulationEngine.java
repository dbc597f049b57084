package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.exception.QuantRiskException;
import com.contractrisk.quant.domain.exception.SimulationCancelledException;
import com.contractrisk.quant.domain.model.RiskSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the trial loop. Trials are split into fixed-size batches that execute on the simulation
 * pool and write into disjoint slices of the output arrays, so the result does not depend on how
 * many batches there are or in which order they finish.
 */
@Slf4j
@Component
public class SimulationEngine {

    private final DistributionSampler sampler;
    private final OccurrenceGate occurrenceGate;
    private final Executor executor;
    private final MonteCarloProperties properties;

    public SimulationEngine(DistributionSampler sampler,
                            OccurrenceGate occurrenceGate,
                            @Qualifier("simulationExecutor") Executor executor,
                            MonteCarloProperties properties) {
        this.sampler = sampler;
        this.occurrenceGate = occurrenceGate;
        this.executor = executor;
        this.properties = properties;
    }

    public SimulationSamples run(List<RiskSpec> risks, int iterations, long seed) {
        return run(risks, iterations, seed, SimulationControl.none());
    }

    public SimulationSamples run(List<RiskSpec> risks, int iterations, long seed, SimulationControl control) {
        try {
            return runAsync(risks, iterations, seed, control).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw new SimulationCancelledException("simulation cancelled", e);
        }
    }

    public CompletableFuture<SimulationSamples> runAsync(List<RiskSpec> risks, int iterations, long seed,
                                                         SimulationControl control) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }

        int riskCount = risks.size();
        double[] totals = new double[iterations];
        double[][] contributions = new double[riskCount][iterations];

        long[] riskKeys = new long[riskCount];
        List<String> riskIds = new ArrayList<>(riskCount);
        for (int r = 0; r < riskCount; r++) {
            riskIds.add(risks.get(r).getId());
            riskKeys[r] = TrialRandomStreams.riskKey(risks.get(r).getId());
        }

        int batchSize = Math.max(1, properties.getBatchSize());
        int shardCount = (iterations + batchSize - 1) / batchSize;
        AtomicInteger completed = new AtomicInteger();
        AtomicBoolean aborted = new AtomicBoolean();
        long startNano = System.nanoTime();

        List<CompletableFuture<Void>> shards = new ArrayList<>(shardCount);
        for (int from = 0; from < iterations; from += batchSize) {
            int start = from;
            int end = Math.min(iterations, from + batchSize);
            try {
                shards.add(CompletableFuture.runAsync(() -> {
                    if (aborted.get()) return;
                    if (control.isCancelled()) {
                        throw new SimulationCancelledException(
                                "simulation cancelled after " + completed.get() + "/" + iterations + " trials");
                    }
                    try {
                        runTrials(risks, riskKeys, seed, start, end, totals, contributions);
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                    control.reportProgress(completed.addAndGet(end - start), iterations);
                }, executor));
            } catch (RejectedExecutionException e) {
                aborted.set(true);
                log.warn("[Engine] 시뮬레이션 풀이 배치를 거부함: trials {}-{}, submitted={}/{}",
                        start, end, shards.size(), shardCount);
                throw new SimulationCancelledException("simulation pool rejected batch " + start + "-" + end, e);
            }
        }

        return CompletableFuture.allOf(shards.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
                    log.debug("[Engine] 시뮬레이션 루프 완료: trials={}, risks={}, shards={}, seed={}, elapsed={}ms",
                            iterations, riskCount, shardCount, seed, elapsedMs);
                    return new SimulationSamples(totals, contributions, riskIds, seed, shardCount);
                });
    }

    private void runTrials(List<RiskSpec> risks, long[] riskKeys, long seed, int from, int to,
                           double[] totals, double[][] contributions) {
        int riskCount = risks.size();
        for (int trial = from; trial < to; trial++) {
            double total = 0.0;
            for (int r = 0; r < riskCount; r++) {
                RiskSpec spec = risks.get(r);
                SplittableRandom occurrenceRng = TrialRandomStreams.occurrence(seed, trial, riskKeys[r]);
                if (!occurrenceGate.occurs(spec.getProbability(), occurrenceRng)) {
                    continue;
                }
                SplittableRandom magnitudeRng = TrialRandomStreams.magnitude(seed, trial, riskKeys[r]);
                double value = sampler.sample(spec, magnitudeRng);
                contributions[r][trial] = value;
                total += value;
            }
            totals[trial] = total;
        }
    }

    static RuntimeException unwrap(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof QuantRiskException quant) return quant;
        if (cause instanceof CancellationException cancel) {
            return new SimulationCancelledException("simulation cancelled", cancel);
        }
        if (cause instanceof RuntimeException runtime) return runtime;
        return new IllegalStateException("simulation failed", cause);
    }
}
