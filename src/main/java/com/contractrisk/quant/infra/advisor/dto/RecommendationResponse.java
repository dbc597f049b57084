package com.contractrisk.quant.infra.advisor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecommendationResponse {
    private String distributionModel;
    private String confidence;
    private String reasoning;
}
