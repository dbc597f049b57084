package com.contractrisk.quant.domain.service.snapshot;

import com.contractrisk.quant.domain.model.MonteCarloSnapshotRecord;
import com.contractrisk.quant.domain.model.SimulationResult;
import com.contractrisk.quant.domain.model.SimulationResult.HistogramBucket;
import com.contractrisk.quant.domain.model.SimulationResult.PercentileRow;
import com.contractrisk.quant.domain.model.SimulationResult.SensitivityItem;
import com.contractrisk.quant.domain.repository.MonteCarloSnapshotRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Stores finished runs as {@link MonteCarloSnapshotRecord}s, with the chart series serialized to
 * JSON columns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSnapshotStore implements SnapshotWriter, SnapshotReader {

    private static final TypeReference<List<HistogramBucket>> HISTOGRAM = new TypeReference<>() { };
    private static final TypeReference<List<PercentileRow>> PERCENTILES = new TypeReference<>() { };
    private static final TypeReference<List<SensitivityItem>> SENSITIVITY = new TypeReference<>() { };

    private final MonteCarloSnapshotRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public Long write(SnapshotMetadata metadata, SimulationResult result) {
        MonteCarloSnapshotRecord record = MonteCarloSnapshotRecord.builder()
                .projectId(metadata.projectId())
                .revisionId(metadata.revisionId())
                .iterations(result.getIterations())
                .targetPercentile(result.getTargetPercentile())
                .seed(result.getSeed())
                .riskCount(result.getRiskCount())
                .base(result.getBase())
                .p10(result.getP10())
                .p50(result.getP50())
                .p90(result.getP90())
                .mean(result.getMean())
                .stdDev(result.getStdDev())
                .targetValue(result.getTargetValue())
                .distributionJson(toJson(result.getDistribution()))
                .percentileTableJson(toJson(result.getPercentileTable()))
                .sensitivityJson(toJson(result.getSensitivityAnalysis()))
                .createdEpochMs(System.currentTimeMillis())
                .build();

        MonteCarloSnapshotRecord saved = repository.save(record);
        log.info("[Snapshot] 저장 완료: id={}, project={}, revision={}, iterations={}",
                saved.getId(), metadata.projectId(), metadata.revisionId(), result.getIterations());
        return saved.getId();
    }

    @Override
    public Optional<SnapshotView> findLatest(String revisionId) {
        return repository.findFirstByRevisionIdOrderByCreatedEpochMsDescIdDesc(revisionId)
                .map(this::toView);
    }

    @Override
    public List<SnapshotView> findByProject(String projectId) {
        return repository.findByProjectIdOrderByCreatedEpochMsDescIdDesc(projectId).stream()
                .map(this::toView)
                .toList();
    }

    private SnapshotView toView(MonteCarloSnapshotRecord record) {
        return SnapshotView.builder()
                .id(record.getId())
                .projectId(record.getProjectId())
                .revisionId(record.getRevisionId())
                .iterations(record.getIterations())
                .targetPercentile(record.getTargetPercentile())
                .seed(record.getSeed())
                .riskCount(record.getRiskCount())
                .base(record.getBase())
                .p10(record.getP10())
                .p50(record.getP50())
                .p90(record.getP90())
                .mean(record.getMean())
                .stdDev(record.getStdDev())
                .targetValue(record.getTargetValue())
                .distribution(fromJson(record.getDistributionJson(), HISTOGRAM))
                .percentileTable(fromJson(record.getPercentileTableJson(), PERCENTILES))
                .sensitivityAnalysis(fromJson(record.getSensitivityJson(), SENSITIVITY))
                .createdEpochMs(record.getCreatedEpochMs())
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("snapshot payload serialization failed", e);
        }
    }

    private <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored snapshot payload is not readable", e);
        }
    }
}
