package com.modelrouter.router.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.modelrouter.common.scoring.CostQualityScoringEngine;
import com.modelrouter.common.scoring.DifficultyMapping;
import com.modelrouter.common.scoring.FeatureDifficultyMapping;
import com.modelrouter.common.scoring.ScoringEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class RouterConfig {

    @Value("${services.classifier.base-url:}")
    private String classifierUrl;

    @Value("${services.policy.base-url}")
    private String policyUrl;

    @Value("${services.decision-log.base-url}")
    private String decisionLogUrl;

    @Value("${router.scoring.difficulty-scale:1.0}")
    private double difficultyScale;

    @Value("${router.scoring.cost-sensitivity:" + CostQualityScoringEngine.DEFAULT_COST_SENSITIVITY + "}")
    private double costSensitivity;

    @Value("${router.scoring.missing-ability-penalty:" + CostQualityScoringEngine.DEFAULT_MISSING_ABILITY_PENALTY + "}")
    private double missingAbilityPenalty;

    @Bean
    public WebClient classifierClient(WebClient.Builder builder) {
        return classifierUrl.isBlank() ? builder.build() : builder.baseUrl(classifierUrl).build();
    }

    @Bean
    public WebClient policyClient(WebClient.Builder builder) {
        return builder.baseUrl(policyUrl).build();
    }

    @Bean
    public WebClient decisionLogClient(WebClient.Builder builder) {
        return builder.baseUrl(decisionLogUrl).build();
    }

    @Bean
    public DifficultyMapping difficultyMapping() {
        return new FeatureDifficultyMapping(difficultyScale);
    }

    @Bean
    public ScoringEngine scoringEngine(DifficultyMapping difficultyMapping) {
        return new CostQualityScoringEngine(difficultyMapping, costSensitivity, missingAbilityPenalty);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
