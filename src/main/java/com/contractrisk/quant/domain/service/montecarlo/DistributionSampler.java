package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.exception.NumericInstabilityException;
import com.contractrisk.quant.domain.model.RiskSpec;
import org.springframework.stereotype.Component;

import java.util.SplittableRandom;

/**
 * Draws one signed sample of a risk's magnitude. P10/P50/P90 are used directly as shape anchors
 * (min/mode/max, or mean and an 80% band for the normal model); they are not fitted as true
 * percentiles of the resulting distribution.
 */
@Component
public class DistributionSampler {

    /** Width of the central 80% band of N(0,1) in standard deviations (2 x 1.28155). */
    static final double NORMAL_P10_P90_SPAN = 2.5631;
    static final double PERT_LAMBDA = 4.0;

    public double sample(RiskSpec spec, SplittableRandom rng) {
        double magnitude = spec.isDegenerate()
                ? spec.getP50()
                : sampleMagnitude(spec, rng);

        if (!Double.isFinite(magnitude)) {
            throw new NumericInstabilityException(spec.getId(),
                    spec.getDistributionModel().getValue() + " sampler produced " + magnitude
                            + " for p10/p50/p90=" + spec.getP10() + "/" + spec.getP50() + "/" + spec.getP90());
        }
        return spec.getKind().sign() * magnitude;
    }

    private double sampleMagnitude(RiskSpec spec, SplittableRandom rng) {
        double min = spec.getP10();
        double mode = spec.getP50();
        double max = spec.getP90();

        return switch (spec.getDistributionModel()) {
            case UNIFORM -> min + rng.nextDouble() * (max - min);
            case TRIANGULAR -> sampleTriangular(min, mode, max, rng.nextDouble());
            case PERT -> samplePert(min, mode, max, rng);
            case NORMAL -> mode + rng.nextGaussian() * ((max - min) / NORMAL_P10_P90_SPAN);
        };
    }

    static double sampleTriangular(double min, double mode, double max, double u) {
        double range = max - min;
        double fc = (mode - min) / range;
        if (u < fc) {
            return min + Math.sqrt(u * range * (mode - min));
        }
        return max - Math.sqrt((1.0 - u) * range * (max - mode));
    }

    private double samplePert(double min, double mode, double max, SplittableRandom rng) {
        double range = max - min;
        double alpha = 1.0 + PERT_LAMBDA * (mode - min) / range;
        double beta = 1.0 + PERT_LAMBDA * (max - mode) / range;
        return min + sampleBeta(alpha, beta, rng) * range;
    }

    /** Beta(alpha, beta) as X / (X + Y) with X ~ Gamma(alpha), Y ~ Gamma(beta). */
    static double sampleBeta(double alpha, double beta, SplittableRandom rng) {
        double x = sampleGamma(alpha, rng);
        double y = sampleGamma(beta, rng);
        return x / (x + y);
    }

    /**
     * Marsaglia-Tsang squeeze method. PERT shapes are always >= 1, which is the range this method
     * covers without the boosting step.
     */
    static double sampleGamma(double shape, SplittableRandom rng) {
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x = rng.nextGaussian();
            double v = 1.0 + c * x;
            if (v <= 0.0) continue;
            v = v * v * v;
            double u = rng.nextDouble();
            double x2 = x * x;
            if (u < 1.0 - 0.0331 * x2 * x2) return d * v;
            if (Math.log(u) < 0.5 * x2 + d * (1.0 - v + Math.log(v))) return d * v;
        }
    }
}
