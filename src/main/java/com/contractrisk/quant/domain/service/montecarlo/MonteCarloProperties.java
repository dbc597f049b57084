package com.contractrisk.quant.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "quant.simulation")
public class MonteCarloProperties {

    private int defaultIterations = 10_000;
    private int maxIterations = 1_000_000;
    /** Upper bound on iterations x risks, the number of per-risk contribution cells a run keeps. */
    private long maxCells = 25_000_000L;
    private double defaultTargetPercentile = 80.0;
    private int batchSize = 5_000;
    private long timeoutMs = 60_000;
    private int histogramBuckets = 50;
    private List<Double> percentiles = List.of(
            5.0, 10.0, 20.0, 25.0, 30.0, 40.0, 50.0, 60.0, 70.0, 75.0, 80.0, 85.0, 90.0, 95.0, 99.0);

    public double[] percentilesArray() {
        return percentiles.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    }
}
