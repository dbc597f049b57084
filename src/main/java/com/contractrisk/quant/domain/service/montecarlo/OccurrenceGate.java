package com.contractrisk.quant.domain.service.montecarlo;

import org.springframework.stereotype.Component;

import java.util.SplittableRandom;

@Component
public class OccurrenceGate {

    /**
     * Single Bernoulli draw. Probabilities of exactly 0 or 1 are decided without touching
     * {@code rng}.
     */
    public boolean occurs(double probability, SplittableRandom rng) {
        if (probability <= 0.0) return false;
        if (probability >= 1.0) return true;
        return rng.nextDouble() < probability;
    }
}
