package com.contractrisk.quant.domain.exception;

/**
 * A sampler produced a non-finite value. Normalized input cannot reach this state, so it always
 * indicates a defect upstream.
 */
public class NumericInstabilityException extends QuantRiskException {

    private final String riskId;

    public NumericInstabilityException(String riskId, String message) {
        super("risk " + riskId + ": " + message);
        this.riskId = riskId;
    }

    public String getRiskId() {
        return riskId;
    }
}
