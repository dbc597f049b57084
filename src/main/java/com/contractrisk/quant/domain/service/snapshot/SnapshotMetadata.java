package com.contractrisk.quant.domain.service.snapshot;

public record SnapshotMetadata(String projectId, String revisionId) {

    public SnapshotMetadata {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be blank");
        }
        if (revisionId == null || revisionId.isBlank()) {
            throw new IllegalArgumentException("revisionId must not be blank");
        }
    }
}
