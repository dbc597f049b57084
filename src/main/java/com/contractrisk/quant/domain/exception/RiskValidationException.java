package com.contractrisk.quant.domain.exception;

import java.util.List;

public class RiskValidationException extends QuantRiskException {

    private final List<ValidationError> errors;

    public RiskValidationException(List<ValidationError> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String summarize(List<ValidationError> errors) {
        if (errors.isEmpty()) return "simulation request rejected";
        ValidationError first = errors.get(0);
        String subject = first.riskId() != null ? "risk " + first.riskId() + " " : "";
        String more = errors.size() > 1 ? " (+" + (errors.size() - 1) + " more)" : "";
        return "simulation request rejected: " + subject + first.field() + " " + first.reason() + more;
    }
}
