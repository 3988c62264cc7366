package com.modelrouter.router.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ClassificationTimeoutException;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.exception.MalformedClassificationException;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.ConversationTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link TaskClassifier} backed by the external classification model service.
 *
 * <p>Request: {@code POST /v1/classify {"prompt": ..., "context": [...]}}.
 * Response: {@code {"domain", "action", "confidence", "reasoning"}}. Domain and action must be
 * non-blank strings and confidence a number in [0, 1]; anything else is malformed.
 */
@Component
public class RemoteTaskClassifier implements TaskClassifier {

    private static final Logger log = LoggerFactory.getLogger(RemoteTaskClassifier.class);

    private final WebClient classifierClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    public RemoteTaskClassifier(@Qualifier("classifierClient") WebClient classifierClient,
                                ObjectMapper objectMapper,
                                @Value("${services.classifier.base-url:}") String baseUrl,
                                @Value("${router.classifier.timeout:400ms}") Duration timeout) {
        this.classifierClient = classifierClient;
        this.objectMapper     = objectMapper;
        this.baseUrl          = baseUrl;
        this.timeout          = timeout;
    }

    @Override
    public Mono<Classification> classify(String prompt, List<ConversationTurn> context) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return Mono.error(new ConfigException("No task classifier configured"));
        }
        Map<String, Object> body = Map.of(
            "prompt",  prompt == null ? "" : prompt,
            "context", context == null ? List.of() : context);

        return classifierClient.post()
            .uri("/v1/classify")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new ClassificationTimeoutException(timeout, e))
            .map(this::parse)
            .doOnNext(c -> log.debug("Classifier answered. label={} confidence={}", c.label(), c.confidence()));
    }

    Classification parse(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new MalformedClassificationException("Classifier response is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedClassificationException("Classifier response is not a JSON object");
        }
        String domain = root.path("domain").asText("");
        String action = root.path("action").asText("");
        JsonNode confidence = root.path("confidence");
        if (domain.isBlank() || action.isBlank()) {
            throw new MalformedClassificationException("Classifier response is missing domain or action");
        }
        if (!confidence.isNumber() || confidence.asDouble() < 0.0 || confidence.asDouble() > 1.0) {
            throw new MalformedClassificationException("Classifier confidence out of range: " + confidence);
        }
        return Classification.of(domain, action, confidence.asDouble(), root.path("reasoning").asText(""));
    }
}
