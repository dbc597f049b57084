package com.contractrisk.quant.domain.service.snapshot;

import com.contractrisk.quant.domain.model.SimulationResult.HistogramBucket;
import com.contractrisk.quant.domain.model.SimulationResult.PercentileRow;
import com.contractrisk.quant.domain.model.SimulationResult.SensitivityItem;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class SnapshotView {

    private final Long id;
    private final String projectId;
    private final String revisionId;
    private final int iterations;
    private final double targetPercentile;
    private final long seed;
    private final int riskCount;
    private final double base;
    private final double p10;
    private final double p50;
    private final double p90;
    private final double mean;
    private final double stdDev;
    private final double targetValue;
    private final List<HistogramBucket> distribution;
    private final List<PercentileRow> percentileTable;
    private final List<SensitivityItem> sensitivityAnalysis;
    private final long createdEpochMs;
}
