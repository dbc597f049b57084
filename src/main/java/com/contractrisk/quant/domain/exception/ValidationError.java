package com.contractrisk.quant.domain.exception;

/**
 * One rejected field. {@code riskId} is null for request-level problems such as the iteration count.
 */
public record ValidationError(String riskId, String field, String reason) {
}
