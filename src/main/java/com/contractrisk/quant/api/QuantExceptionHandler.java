package com.contractrisk.quant.api;

import com.contractrisk.quant.domain.exception.NumericInstabilityException;
import com.contractrisk.quant.domain.exception.RiskValidationException;
import com.contractrisk.quant.domain.exception.SimulationCancelledException;
import com.contractrisk.quant.domain.exception.UnsupportedDistributionException;
import com.contractrisk.quant.domain.exception.ValidationError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class QuantExceptionHandler {

    @ExceptionHandler(UnsupportedDistributionException.class)
    public ResponseEntity<ApiError> handleUnsupported(UnsupportedDistributionException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Unsupported distribution model '" + ex.getDistributionModel()
                + "' for risk " + ex.getRiskId(), ex.getErrors(), request);
    }

    @ExceptionHandler(RiskValidationException.class)
    public ResponseEntity<ApiError> handleValidation(RiskValidationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Risk register validation failed", ex.getErrors(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request);
    }

    @ExceptionHandler(NumericInstabilityException.class)
    public ResponseEntity<ApiError> handleNumeric(NumericInstabilityException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                List.of(new ValidationError(ex.getRiskId(), "distributionModel", "sampling produced a non-finite value")),
                request);
    }

    @ExceptionHandler(SimulationCancelledException.class)
    public ResponseEntity<ApiError> handleCancelled(SimulationCancelledException ex, HttpServletRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("[API] 스냅샷 저장소 오류: path={}", request.getRequestURI(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Snapshot storage unavailable", List.of(), request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String message, List<ValidationError> details,
                                           HttpServletRequest request) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details)
                .build();
        log.warn("[API] {} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        return ResponseEntity.status(status).body(error);
    }
}
