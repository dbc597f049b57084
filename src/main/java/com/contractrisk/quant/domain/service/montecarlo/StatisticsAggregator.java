package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.model.SimulationResult.HistogramBucket;
import com.contractrisk.quant.domain.service.montecarlo.StatisticsSummary.PercentilePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class StatisticsAggregator {

    private final MonteCarloProperties properties;

    public StatisticsSummary summarize(double[] totals, double targetPercentile) {
        if (totals == null || totals.length == 0) {
            throw new IllegalArgumentException("totals must not be empty");
        }
        if (!(targetPercentile >= 0.0 && targetPercentile <= 100.0)) {
            throw new IllegalArgumentException("targetPercentile must be within [0, 100]: " + targetPercentile);
        }

        double[] sorted = totals.clone();
        Arrays.sort(sorted);

        double mean = mean(totals);
        double stdDev = sampleStdDev(totals, mean);

        double[] tablePercentiles = properties.percentilesArray();
        List<PercentilePoint> table = new ArrayList<>(tablePercentiles.length);
        for (double p : tablePercentiles) {
            table.add(new PercentilePoint(p, percentile(sorted, p)));
        }

        List<HistogramBucket> histogram = histogram(sorted, properties.getHistogramBuckets());

        log.debug("[Stats] 집계 완료: n={}, mean={}, stdDev={}, buckets={}",
                totals.length, mean, stdDev, histogram.size());

        return StatisticsSummary.builder()
                .p10(percentile(sorted, 10))
                .p50(percentile(sorted, 50))
                .p90(percentile(sorted, 90))
                .mean(mean)
                .stdDev(stdDev)
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .targetPercentile(targetPercentile)
                .targetValue(percentile(sorted, targetPercentile))
                .percentileTable(table)
                .distribution(histogram)
                .build();
    }

    /** Linear interpolation between the two nearest ranks, rank = p/100 * (n-1). */
    static double percentile(double[] sorted, double p) {
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = index - lower;
        if (fraction == 0.0) return sorted[lower];
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    static double mean(double[] values) {
        return kahanSum(values, 0.0, false) / values.length;
    }

    static double sampleStdDev(double[] values, double mean) {
        return Math.sqrt(sampleVariance(values, mean));
    }

    /** Bessel-corrected; a single observation has zero spread. */
    static double sampleVariance(double[] values, double mean) {
        if (values.length < 2) return 0.0;
        return kahanSum(values, mean, true) / (values.length - 1);
    }

    private static double kahanSum(double[] values, double mean, boolean squaredDeviation) {
        double sum = 0.0;
        double compensation = 0.0;
        for (double v : values) {
            double term = squaredDeviation ? (v - mean) * (v - mean) : v;
            double y = term - compensation;
            double t = sum + y;
            compensation = (t - sum) - y;
            sum = t;
        }
        return sum;
    }

    /**
     * Buckets of a "nice" width (1, 2, 2.5 or 5 x 10^k) covering exactly [min, max]: the first
     * bucket starts at the smallest total and the last one is clamped to end at the largest.
     */
    static List<HistogramBucket> histogram(double[] sorted, int targetBuckets) {
        double min = sorted[0];
        double max = sorted[sorted.length - 1];
        double range = max - min;

        if (range <= 0.0 || targetBuckets <= 1) {
            return List.of(HistogramBucket.builder()
                    .bucketStart(min)
                    .bucketEnd(max)
                    .count(sorted.length)
                    .build());
        }

        double width = niceCeil(range / targetBuckets);
        int bucketCount = (int) Math.ceil(range / width);
        bucketCount = Math.max(1, Math.min(bucketCount, targetBuckets));

        int[] counts = new int[bucketCount];
        for (double v : sorted) {
            int idx = (int) ((v - min) / width);
            counts[Math.max(0, Math.min(idx, bucketCount - 1))]++;
        }

        List<HistogramBucket> buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            double start = min + i * width;
            double end = i == bucketCount - 1 ? max : min + (i + 1) * width;
            buckets.add(HistogramBucket.builder()
                    .bucketStart(start)
                    .bucketEnd(end)
                    .count(counts[i])
                    .build());
        }
        return buckets;
    }

    static double niceCeil(double raw) {
        double exponent = Math.floor(Math.log10(raw));
        double magnitude = Math.pow(10, exponent);
        double fraction = raw / magnitude;
        double nice;
        if (fraction <= 1.0) nice = 1.0;
        else if (fraction <= 2.0) nice = 2.0;
        else if (fraction <= 2.5) nice = 2.5;
        else if (fraction <= 5.0) nice = 5.0;
        else nice = 10.0;
        return nice * magnitude;
    }
}
