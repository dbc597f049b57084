package com.contractrisk.quant.domain.service.snapshot;

import java.util.List;
import java.util.Optional;

public interface SnapshotReader {

    /** Newest snapshot of a revision; ties on creation time go to the higher id. */
    Optional<SnapshotView> findLatest(String revisionId);

    /** All snapshots of a project, newest first. */
    List<SnapshotView> findByProject(String projectId);
}
