package com.contractrisk.quant.domain.service.advisor;

import com.contractrisk.quant.domain.model.DistributionModel;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DistributionRecommendation {

    private final String riskId;
    private final DistributionModel distributionModel;
    private final String confidence;
    private final String reasoning;
}
