package com.contractrisk.quant.domain.repository;

import com.contractrisk.quant.domain.model.MonteCarloSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MonteCarloSnapshotRepository extends JpaRepository<MonteCarloSnapshotRecord, Long> {

    Optional<MonteCarloSnapshotRecord> findFirstByRevisionIdOrderByCreatedEpochMsDescIdDesc(String revisionId);

    List<MonteCarloSnapshotRecord> findByProjectIdOrderByCreatedEpochMsDescIdDesc(String projectId);
}
