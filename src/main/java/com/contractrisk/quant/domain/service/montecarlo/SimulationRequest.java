package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.model.RiskInput;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * One simulation call. Null {@code iterations} or {@code targetPercentile} fall back to the
 * configured defaults; a null {@code seed} makes the run non-reproducible and the generated seed
 * is reported in the result.
 */
@Getter
@Builder
public class SimulationRequest {

    private final List<RiskInput> risks;
    private final Integer iterations;
    private final Double targetPercentile;
    private final Long seed;
}
