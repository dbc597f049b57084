package com.contractrisk.quant.infra.advisor;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "quant.advisor")
public class AdvisorProperties {

    private boolean enabled = false;

    private String baseUrl = "http://localhost:8090/api/risk-distribution";

    private long connectTimeoutMs = 5_000;

    private long readTimeoutMs = 30_000;

    public String recommendUrl() {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return trimmed + "/recommend";
    }
}
