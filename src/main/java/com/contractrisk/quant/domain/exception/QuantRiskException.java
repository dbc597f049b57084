package com.contractrisk.quant.domain.exception;

/**
 * Base type for every failure raised by the simulation core. All of them terminate the request;
 * there is no partial-result mode.
 */
public abstract class QuantRiskException extends RuntimeException {

    protected QuantRiskException(String message) {
        super(message);
    }

    protected QuantRiskException(String message, Throwable cause) {
        super(message, cause);
    }
}
