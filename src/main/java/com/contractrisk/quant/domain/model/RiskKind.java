package com.contractrisk.quant.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum RiskKind {
    THREAT("threat", 1.0),
    OPPORTUNITY("opportunity", -1.0);

    private final String value;
    private final double sign;

    RiskKind(String value, double sign) {
        this.value = value;
        this.sign = sign;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** +1 for threats, -1 for opportunities (credits). */
    public double sign() {
        return sign;
    }

    public static Optional<RiskKind> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (RiskKind kind : values()) {
            if (kind.value.equals(key)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
