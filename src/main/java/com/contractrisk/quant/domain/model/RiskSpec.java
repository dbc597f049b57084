package com.contractrisk.quant.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Validated register entry. The three points are stored as non-negative magnitudes with
 * {@code p10 <= p50 <= p90}; the direction of the exposure comes from {@link #getKind()}.
 */
@Getter
@Builder
@ToString
public class RiskSpec {

    private final String id;
    private final String riskNumber;
    private final String title;
    private final RiskKind kind;
    private final double p10;
    private final double p50;
    private final double p90;
    private final double probability;
    private final DistributionModel distributionModel;

    public boolean isDegenerate() {
        return p10 == p90;
    }

    public double signedP50() {
        return kind.sign() * p50;
    }
}
