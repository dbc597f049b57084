package com.contractrisk.quant.domain.exception;

public class SimulationCancelledException extends QuantRiskException {

    public SimulationCancelledException(String message) {
        super(message);
    }

    public SimulationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
