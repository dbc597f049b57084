package com.contractrisk.quant.domain.exception;

import java.util.List;

/**
 * Raised when at least one entry names a distribution model the sampler does not implement.
 * {@link #getErrors()} still lists every problem found in the request.
 */
public class UnsupportedDistributionException extends RiskValidationException {

    private final String riskId;
    private final String distributionModel;

    public UnsupportedDistributionException(String riskId, String distributionModel,
                                            List<ValidationError> errors) {
        super(errors);
        this.riskId = riskId;
        this.distributionModel = distributionModel;
    }

    public String getRiskId() {
        return riskId;
    }

    public String getDistributionModel() {
        return distributionModel;
    }
}
