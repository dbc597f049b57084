package com.contractrisk.quant.api;

import com.contractrisk.quant.domain.exception.ValidationError;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class ApiError {
    private final Instant timestamp;
    private final String path;
    private final int status;
    private final String error;
    private final String message;
    private final List<ValidationError> details;
}
