package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.model.SimulationResult.SensitivityItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Leave-one-out variance ranking (tornado ordering). For each risk the total is recomputed with
 * that risk's column removed, and the risk's contribution is the variance that disappears:
 * {@code Var(total) - Var(total - column)}.
 */
@Slf4j
@Component
public class SensitivityAnalyzer {

    static final Comparator<SensitivityItem> RANKING =
            Comparator.comparingDouble(SensitivityItem::getContribution).reversed()
                    .thenComparing(SensitivityItem::getRiskId);

    /**
     * @param contributions one column per risk, {@code contributions[riskIndex][trial]}, in the
     *                      order of {@code riskIds}
     */
    public List<SensitivityItem> rank(double[][] contributions, List<String> riskIds) {
        int riskCount = riskIds.size();
        if (contributions.length != riskCount) {
            throw new IllegalArgumentException("matrix has " + contributions.length
                    + " columns, expected " + riskCount);
        }
        if (riskCount == 0 || contributions[0].length == 0) {
            throw new IllegalArgumentException("contribution matrix must not be empty");
        }
        int n = contributions[0].length;

        double[] totals = new double[n];
        for (int r = 0; r < riskCount; r++) {
            double[] column = contributions[r];
            if (column.length != n) {
                throw new IllegalArgumentException("column " + r + " has " + column.length
                        + " trials, expected " + n);
            }
            for (int t = 0; t < n; t++) totals[t] += column[t];
        }

        double totalMean = StatisticsAggregator.mean(totals);
        double totalVariance = StatisticsAggregator.sampleVariance(totals, totalMean);
        double totalStd = Math.sqrt(totalVariance);

        double[] leaveOneOut = new double[n];
        List<SensitivityItem> items = new ArrayList<>(riskCount);

        for (int r = 0; r < riskCount; r++) {
            double[] column = contributions[r];
            for (int t = 0; t < n; t++) {
                leaveOneOut[t] = totals[t] - column[t];
            }
            double looVariance = StatisticsAggregator.sampleVariance(leaveOneOut, StatisticsAggregator.mean(leaveOneOut));
            double contribution = totalVariance - looVariance;

            items.add(SensitivityItem.builder()
                    .riskId(riskIds.get(r))
                    .contribution(contribution)
                    .varianceShare(totalVariance > 0 ? contribution / totalVariance : 0.0)
                    .correlation(correlation(column, totals, totalMean, totalStd))
                    .build());
        }

        items.sort(RANKING);

        if (log.isDebugEnabled() && !items.isEmpty()) {
            SensitivityItem top = items.get(0);
            log.debug("[Sensitivity] 순위 산출: risks={}, var={}, top={} ({}%)",
                    riskCount, totalVariance, top.getRiskId(), String.format("%.1f", top.getVarianceShare() * 100));
        }
        return items;
    }

    private static double correlation(double[] column, double[] totals, double totalMean, double totalStd) {
        int n = column.length;
        if (n < 2 || totalStd == 0.0) return 0.0;
        double columnMean = StatisticsAggregator.mean(column);
        double columnStd = StatisticsAggregator.sampleStdDev(column, columnMean);
        if (columnStd == 0.0) return 0.0;

        double cov = 0.0;
        for (int t = 0; t < n; t++) {
            cov += (column[t] - columnMean) * (totals[t] - totalMean);
        }
        cov /= (n - 1);
        return cov / (columnStd * totalStd);
    }
}
