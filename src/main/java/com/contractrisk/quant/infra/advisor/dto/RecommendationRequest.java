package com.contractrisk.quant.infra.advisor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {
    private String riskId;
    private String riskNumber;
    private String title;
    private Double optimisticP10;
    private Double likelyP50;
    private Double pessimisticP90;
}
