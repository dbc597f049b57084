package com.contractrisk.quant.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationResult {

    private double base;
    private double p10;
    private double p50;
    private double p90;
    private double mean;
    private double stdDev;
    private double targetPercentile;
    private double targetValue;
    private List<HistogramBucket> distribution;
    private List<PercentileRow> percentileTable;
    private List<SensitivityItem> sensitivityAnalysis;

    private int iterations;
    private int riskCount;
    private long seed;
    private boolean seedGenerated;
    private int shardCount;
    private long calcDurationMillis;
    private long timestamp;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistogramBucket {
        private double bucketStart;
        private double bucketEnd;
        private int count;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PercentileRow {
        private double percentile;
        private double value;
        private double varianceFromBase;
    }

    @Getter
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SensitivityItem {
        private String riskId;
        private String riskNumber;
        private String title;
        /** Var(total) minus Var(total with this risk removed). */
        private double contribution;
        private double varianceShare;
        private double correlation;
    }
}
