package com.contractrisk.quant.domain.service.montecarlo;

import lombok.Getter;

import java.util.List;

/**
 * Raw engine output: {@code totals[trial]} and {@code contributions[riskIndex][trial]}, where the
 * risk index follows {@code riskIds}. Contributions are stored one column per risk so a run costs
 * {@code riskCount} arrays rather than one array per trial.
 */
@Getter
public class SimulationSamples {

    private final double[] totals;
    private final double[][] contributions;
    private final List<String> riskIds;
    private final long seed;
    private final int shardCount;

    public SimulationSamples(double[] totals, double[][] contributions, List<String> riskIds,
                             long seed, int shardCount) {
        this.totals = totals;
        this.contributions = contributions;
        this.riskIds = List.copyOf(riskIds);
        this.seed = seed;
        this.shardCount = shardCount;
    }

    public int iterations() {
        return totals.length;
    }
}
