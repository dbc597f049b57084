package com.contractrisk.quant.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "monte_carlo_snapshot", indexes = {
        @Index(name = "idx_mc_snapshot_revision", columnList = "revisionId, createdEpochMs"),
        @Index(name = "idx_mc_snapshot_project", columnList = "projectId")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonteCarloSnapshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String projectId;
    private String revisionId;

    private int iterations;
    private double targetPercentile;
    private long seed;
    private int riskCount;

    private double base;
    private double p10;
    private double p50;
    private double p90;
    private double mean;
    private double stdDev;
    private double targetValue;

    @Column(columnDefinition = "TEXT")
    private String distributionJson;

    @Column(columnDefinition = "TEXT")
    private String percentileTableJson;

    @Column(columnDefinition = "TEXT")
    private String sensitivityJson;

    private long createdEpochMs;
}
