package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.model.SimulationResult.HistogramBucket;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class StatisticsSummary {

    private final double p10;
    private final double p50;
    private final double p90;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final double targetPercentile;
    private final double targetValue;
    private final List<PercentilePoint> percentileTable;
    private final List<HistogramBucket> distribution;

    public record PercentilePoint(double percentile, double value) {
    }
}
