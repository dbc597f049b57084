package com.contractrisk.quant.infra.advisor;

import com.contractrisk.quant.domain.model.DistributionModel;
import com.contractrisk.quant.domain.model.RiskInput;
import com.contractrisk.quant.domain.service.advisor.DistributionModelSelector;
import com.contractrisk.quant.domain.service.advisor.DistributionRecommendation;
import com.contractrisk.quant.infra.advisor.dto.RecommendationRequest;
import com.contractrisk.quant.infra.advisor.dto.RecommendationResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Client for the distribution advisory service. Any transport or parsing failure, and any model
 * this engine does not implement (the advisor may answer {@code lognormal} or {@code weibull}),
 * yields an empty recommendation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "quant.advisor", name = "enabled", havingValue = "true")
public class RemoteDistributionAdvisor implements DistributionModelSelector {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient advisorHttpClient;
    private final AdvisorProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<DistributionRecommendation> recommend(RiskInput risk) {
        if (risk.getP10() == null || risk.getP50() == null || risk.getP90() == null) {
            log.debug("[Advisor] 3점 추정치 누락, 추천 생략: risk={}", risk.getId());
            return Optional.empty();
        }

        RecommendationRequest payload = RecommendationRequest.builder()
                .riskId(risk.getId())
                .riskNumber(risk.getRiskNumber())
                .title(risk.getTitle())
                .optimisticP10(risk.getP10())
                .likelyP50(risk.getP50())
                .pessimisticP90(risk.getP90())
                .build();

        Request request;
        try {
            request = new Request.Builder()
                    .url(properties.recommendUrl())
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            log.error("[Advisor] 요청 직렬화 실패: risk={}", risk.getId(), e);
            return Optional.empty();
        }

        try (Response response = advisorHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[Advisor] 추천 요청 실패: risk={}, code={}", risk.getId(), response.code());
                return Optional.empty();
            }

            ResponseBody body = response.body();
            if (body == null) return Optional.empty();

            RecommendationResponse parsed = objectMapper.readValue(body.string(), RecommendationResponse.class);
            Optional<DistributionModel> model = DistributionModel.fromValue(parsed.getDistributionModel());
            if (model.isEmpty()) {
                log.warn("[Advisor] 지원하지 않는 추천 모델: risk={}, model={}",
                        risk.getId(), parsed.getDistributionModel());
                return Optional.empty();
            }

            log.debug("[Advisor] 추천 수신: risk={}, model={}, confidence={}",
                    risk.getId(), model.get().getValue(), parsed.getConfidence());
            return Optional.of(DistributionRecommendation.builder()
                    .riskId(risk.getId())
                    .distributionModel(model.get())
                    .confidence(parsed.getConfidence())
                    .reasoning(parsed.getReasoning())
                    .build());

        } catch (IOException e) {
            log.error("[Advisor] 추천 요청 예외: risk={}", risk.getId(), e);
            return Optional.empty();
        }
    }
}
