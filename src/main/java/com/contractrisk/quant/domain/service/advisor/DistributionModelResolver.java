package com.contractrisk.quant.domain.service.advisor;

import com.contractrisk.quant.domain.model.RiskInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fills in a missing {@code distributionModel} from the advisory selector, when one is
 * configured. Entries that already name a model are never overridden, and entries the selector
 * cannot resolve are passed through unchanged so that validation rejects them.
 */
@Slf4j
@Component
public class DistributionModelResolver {

    private final DistributionModelSelector selector;

    @Autowired
    public DistributionModelResolver(ObjectProvider<DistributionModelSelector> selectorProvider) {
        this(selectorProvider.getIfAvailable());
    }

    public DistributionModelResolver(DistributionModelSelector selector) {
        this.selector = selector;
    }

    public List<RiskInput> resolveMissing(List<RiskInput> risks) {
        if (selector == null || risks == null) return risks;

        List<RiskInput> resolved = new ArrayList<>(risks.size());
        int filled = 0;
        int unresolved = 0;
        for (RiskInput risk : risks) {
            if (risk == null || !isMissing(risk.getDistributionModel())) {
                resolved.add(risk);
                continue;
            }
            Optional<DistributionRecommendation> recommendation = selector.recommend(risk);
            if (recommendation.isPresent()) {
                resolved.add(risk.toBuilder()
                        .distributionModel(recommendation.get().getDistributionModel().getValue())
                        .build());
                filled++;
            } else {
                resolved.add(risk);
                unresolved++;
            }
        }

        if (filled > 0 || unresolved > 0) {
            log.info("[Advisor] 분포 모델 보완: filled={}, unresolved={}", filled, unresolved);
        }
        return resolved;
    }

    private boolean isMissing(String model) {
        return model == null || model.isBlank();
    }
}
