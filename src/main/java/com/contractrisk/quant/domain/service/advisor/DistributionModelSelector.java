package com.contractrisk.quant.domain.service.advisor;

import com.contractrisk.quant.domain.model.RiskInput;

import java.util.Optional;

/**
 * External advisory process that picks a distribution shape for a register entry from its
 * three-point estimate. Implementations may call out over the network; the simulation core never
 * does.
 */
public interface DistributionModelSelector {

    Optional<DistributionRecommendation> recommend(RiskInput risk);
}
