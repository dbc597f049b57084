package com.contractrisk.quant.domain.service.snapshot;

import com.contractrisk.quant.domain.model.SimulationResult;

/**
 * Persistence boundary for finished runs. Failures propagate to the caller unchanged and are not
 * retried here.
 */
public interface SnapshotWriter {

    /** @return identifier of the stored snapshot */
    Long write(SnapshotMetadata metadata, SimulationResult result);
}
