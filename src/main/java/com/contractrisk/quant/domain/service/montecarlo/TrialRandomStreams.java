package com.contractrisk.quant.domain.service.montecarlo;

import java.nio.charset.StandardCharsets;
import java.util.SplittableRandom;

/**
 * Derives the random streams for one (seed, trial, risk) cell. Each cell gets its own occurrence
 * stream and magnitude stream, so the draws of a cell depend only on the seed, the trial index
 * and the risk id: not on shard boundaries, on the other risks in the register, or on whether the
 * occurrence gate consumed a draw.
 */
final class TrialRandomStreams {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;
    private static final long OCCURRENCE_SALT = 0x6a09e667f3bcc909L;
    private static final long MAGNITUDE_SALT = 0xbb67ae8584caa73bL;

    private TrialRandomStreams() {
    }

    static long riskKey(String riskId) {
        // FNV-1a over the UTF-8 bytes, then finalized
        long hash = 0xcbf29ce484222325L;
        for (byte b : riskId.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= 0x100000001b3L;
        }
        return mix64(hash);
    }

    static SplittableRandom occurrence(long seed, int trial, long riskKey) {
        return new SplittableRandom(mix64(cell(seed, trial, riskKey) ^ OCCURRENCE_SALT));
    }

    static SplittableRandom magnitude(long seed, int trial, long riskKey) {
        return new SplittableRandom(mix64(cell(seed, trial, riskKey) ^ MAGNITUDE_SALT));
    }

    private static long cell(long seed, int trial, long riskKey) {
        return mix64(mix64(seed + GOLDEN_GAMMA * (trial + 1L)) ^ riskKey);
    }

    /** SplitMix64 finalizer. */
    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
