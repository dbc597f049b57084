package com.contractrisk.quant.api;

import com.contractrisk.quant.domain.model.SimulationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SimulationRunResponse {

    @JsonUnwrapped
    private final SimulationResult result;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Long snapshotId;
}
