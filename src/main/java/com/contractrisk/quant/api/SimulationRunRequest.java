package com.contractrisk.quant.api;

import com.contractrisk.quant.domain.model.RiskInput;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationRunRequest {

    private String projectId;
    private String revisionId;
    private List<RiskInput> risks;
    private Integer iterations;
    private Double targetPercentile;
    private Long seed;

    public boolean hasSnapshotTarget() {
        return projectId != null && !projectId.isBlank()
                && revisionId != null && !revisionId.isBlank();
    }
}
