package com.contractrisk.quant.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Register entry as supplied by the caller, before validation. Numeric fields are boxed so that
 * missing values can be reported instead of silently read as zero.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskInput {

    private String id;
    private String riskNumber;
    private String title;

    @JsonAlias("riskType")
    private String kind;

    @JsonAlias("optimisticP10")
    private Double p10;

    @JsonAlias("likelyP50")
    private Double p50;

    @JsonAlias("pessimisticP90")
    private Double p90;

    private Double probability;
    private String distributionModel;
}
