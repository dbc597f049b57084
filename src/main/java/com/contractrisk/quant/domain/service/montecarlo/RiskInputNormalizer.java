package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.exception.RiskValidationException;
import com.contractrisk.quant.domain.exception.UnsupportedDistributionException;
import com.contractrisk.quant.domain.exception.ValidationError;
import com.contractrisk.quant.domain.model.DistributionModel;
import com.contractrisk.quant.domain.model.RiskInput;
import com.contractrisk.quant.domain.model.RiskKind;
import com.contractrisk.quant.domain.model.RiskSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns raw register entries into {@link RiskSpec}s. Every entry is checked before anything is
 * rejected so the caller gets the complete list of problems in one response; a single bad entry
 * rejects the whole register.
 */
@Slf4j
@Component
public class RiskInputNormalizer {

    private static final int MIXED_SIGNS = 2;

    public List<RiskSpec> normalize(List<RiskInput> rawRisks) {
        if (rawRisks == null || rawRisks.isEmpty()) {
            throw new RiskValidationException(List.of(
                    new ValidationError(null, "risks", "must contain at least one risk")));
        }

        List<ValidationError> errors = new ArrayList<>();
        ValidationError firstUnsupported = null;
        String firstUnsupportedModel = null;
        Set<String> seenIds = new HashSet<>();
        List<RiskSpec> specs = new ArrayList<>(rawRisks.size());

        for (int i = 0; i < rawRisks.size(); i++) {
            RiskInput raw = rawRisks.get(i);
            if (raw == null) {
                errors.add(new ValidationError("#" + i, "risk", "must not be null"));
                continue;
            }

            String label = label(raw, i);
            int errorsBefore = errors.size();

            if (raw.getId() == null || raw.getId().isBlank()) {
                errors.add(new ValidationError(label, "id", "is required"));
            } else if (!seenIds.add(raw.getId())) {
                errors.add(new ValidationError(label, "id", "is duplicated in the register"));
            }

            Double p10 = requireFinite(raw.getP10(), label, "p10", errors);
            Double p50 = requireFinite(raw.getP50(), label, "p50", errors);
            Double p90 = requireFinite(raw.getP90(), label, "p90", errors);
            int sign = 0;
            if (p10 != null && p50 != null && p90 != null) {
                sign = signOf(p10, p50, p90);
                if (sign == MIXED_SIGNS) {
                    errors.add(new ValidationError(label, "p10/p50/p90",
                            "mixed signs, got " + p10 + "/" + p50 + "/" + p90));
                    sign = 0;
                }
                double a10 = Math.abs(p10);
                double a50 = Math.abs(p50);
                double a90 = Math.abs(p90);
                if (a10 > a50 || a50 > a90) {
                    errors.add(new ValidationError(label, "p10/p50/p90",
                            "must satisfy |p10| <= |p50| <= |p90|, got " + p10 + "/" + p50 + "/" + p90));
                }
            }

            Double probability = requireFinite(raw.getProbability(), label, "probability", errors);
            if (probability != null && (probability < 0.0 || probability > 1.0)) {
                errors.add(new ValidationError(label, "probability",
                        "must be within [0, 1], got " + probability));
            }

            RiskKind kind = resolveKind(raw, label, sign, errors);

            DistributionModel model = null;
            String rawModel = raw.getDistributionModel();
            if (rawModel == null || rawModel.isBlank()) {
                errors.add(new ValidationError(label, "distributionModel", "is required"));
            } else {
                Optional<DistributionModel> parsed = DistributionModel.fromValue(rawModel);
                if (parsed.isPresent()) {
                    model = parsed.get();
                } else {
                    ValidationError unsupported = new ValidationError(label, "distributionModel",
                            "unsupported model '" + rawModel + "'");
                    errors.add(unsupported);
                    if (firstUnsupported == null) {
                        firstUnsupported = unsupported;
                        firstUnsupportedModel = rawModel;
                    }
                }
            }

            if (errors.size() == errorsBefore) {
                specs.add(RiskSpec.builder()
                        .id(raw.getId())
                        .riskNumber(raw.getRiskNumber())
                        .title(raw.getTitle())
                        .kind(kind)
                        .p10(Math.abs(p10))
                        .p50(Math.abs(p50))
                        .p90(Math.abs(p90))
                        .probability(probability)
                        .distributionModel(model)
                        .build());
            }
        }

        if (firstUnsupported != null) {
            log.warn("[Normalizer] 지원하지 않는 분포 모델: risk={}, model={}, errors={}",
                    firstUnsupported.riskId(), firstUnsupportedModel, errors.size());
            throw new UnsupportedDistributionException(firstUnsupported.riskId(), firstUnsupportedModel, errors);
        }
        if (!errors.isEmpty()) {
            log.warn("[Normalizer] 리스크 등록부 검증 실패: risks={}, errors={}, first={}",
                    rawRisks.size(), errors.size(), errors.get(0));
            throw new RiskValidationException(errors);
        }

        log.debug("[Normalizer] 정규화 완료: risks={}", specs.size());
        return specs;
    }

    /**
     * Without an explicit kind the sign of the estimate decides: negative points are a credit.
     * An explicit threat with a negative estimate, or a risk number whose R/O prefix disagrees
     * with the kind, is rejected rather than reconciled.
     */
    private RiskKind resolveKind(RiskInput raw, String label, int sign, List<ValidationError> errors) {
        RiskKind kind;
        if (raw.getKind() == null || raw.getKind().isBlank()) {
            if (sign < 0) {
                kind = RiskKind.OPPORTUNITY;
            } else if (sign > 0) {
                kind = RiskKind.THREAT;
            } else {
                kind = numberPrefix(raw) == 'O' ? RiskKind.OPPORTUNITY : RiskKind.THREAT;
            }
        } else {
            Optional<RiskKind> parsed = RiskKind.fromValue(raw.getKind());
            if (parsed.isEmpty()) {
                errors.add(new ValidationError(label, "kind",
                        "must be 'threat' or 'opportunity', got '" + raw.getKind() + "'"));
                return null;
            }
            kind = parsed.get();
            if (kind == RiskKind.THREAT && sign < 0) {
                errors.add(new ValidationError(label, "kind",
                        "threat with a negative (credit) estimate"));
            }
        }

        char prefix = numberPrefix(raw);
        char expected = kind == RiskKind.OPPORTUNITY ? 'O' : 'R';
        if ((prefix == 'R' || prefix == 'O') && prefix != expected) {
            errors.add(new ValidationError(label, "riskNumber",
                    "prefix '" + prefix + "' does not match " + kind.getValue()
                            + ", expected '" + expected + "'"));
        }
        return kind;
    }

    /** -1 when every non-zero point is negative, +1 when none is, 0 when all are zero. */
    private static int signOf(double p10, double p50, double p90) {
        boolean negative = p10 < 0 || p50 < 0 || p90 < 0;
        boolean positive = p10 > 0 || p50 > 0 || p90 > 0;
        if (negative && positive) return MIXED_SIGNS;
        if (negative) return -1;
        return positive ? 1 : 0;
    }

    private static char numberPrefix(RiskInput raw) {
        String number = raw.getRiskNumber();
        if (number == null || number.isBlank()) return ' ';
        return number.trim().toUpperCase(Locale.ROOT).charAt(0);
    }

    private Double requireFinite(Double value, String label, String field, List<ValidationError> errors) {
        if (value == null) {
            errors.add(new ValidationError(label, field, "is required"));
            return null;
        }
        if (!Double.isFinite(value)) {
            errors.add(new ValidationError(label, field, "must be a finite number"));
            return null;
        }
        return value;
    }

    private String label(RiskInput raw, int index) {
        return raw.getId() != null && !raw.getId().isBlank() ? raw.getId() : "#" + index;
    }
}
