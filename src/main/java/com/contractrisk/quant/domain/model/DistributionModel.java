package com.contractrisk.quant.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Shape used to sample a risk's magnitude from its three-point estimate.
 */
public enum DistributionModel {
    TRIANGULAR("triangular"),
    PERT("pert"),
    NORMAL("normal"),
    UNIFORM("uniform");

    private final String value;

    DistributionModel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<DistributionModel> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.value.equals(key))
                .findFirst();
    }
}
