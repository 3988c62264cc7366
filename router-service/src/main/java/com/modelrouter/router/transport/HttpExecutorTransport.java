package com.modelrouter.router.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.ExecutorDescriptor;
import com.modelrouter.common.model.ModelInfo;
import com.modelrouter.common.model.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP executor adapter.
 *
 * <ul>
 *   <li>{@code listModels}: {@code GET {endpoint}/v1/models}; accepts an OpenAI-style
 *       {@code {"data": [...]}} envelope or a bare JSON array</li>
 *   <li>{@code healthCheck}: {@code GET {endpoint}/health}; any 2xx is healthy</li>
 * </ul>
 */
@Component
public class HttpExecutorTransport implements ExecutorTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpExecutorTransport.class);

    private final WebClient.Builder builder;
    private final ObjectMapper objectMapper;

    public HttpExecutorTransport(WebClient.Builder builder, ObjectMapper objectMapper) {
        this.builder      = builder;
        this.objectMapper = objectMapper;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.HTTP;
    }

    @Override
    public ExecutorClient connect(ExecutorDescriptor descriptor) {
        if (descriptor.endpoint() == null || descriptor.endpoint().isBlank()) {
            throw new ConfigException("HTTP executor " + descriptor.id() + " has no endpoint");
        }
        WebClient client = builder.clone().baseUrl(descriptor.endpoint()).build();
        return new HttpExecutorClient(descriptor.id(), client);
    }

    private class HttpExecutorClient implements ExecutorClient {

        private final String executorId;
        private final WebClient client;

        HttpExecutorClient(String executorId, WebClient client) {
            this.executorId = executorId;
            this.client     = client;
        }

        @Override
        public Mono<List<ModelInfo>> listModels() {
            return client.get()
                .uri("/v1/models")
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> parseModels(executorId, body));
        }

        @Override
        public Mono<Boolean> healthCheck() {
            return client.get()
                .uri("/health")
                .retrieve()
                .toBodilessEntity()
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .onErrorResume(e -> {
                    log.debug("Health check failed. executorId={} reason={}", executorId, e.getMessage());
                    return Mono.just(false);
                });
        }
    }

    List<ModelInfo> parseModels(String executorId, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode items = root.isArray() ? root : root.path("data");
            List<ModelInfo> models = new ArrayList<>();
            for (JsonNode item : items) {
                String id = text(item, "id", text(item, "name", null));
                if (id == null || id.isBlank()) continue;
                List<String> tags = new ArrayList<>();
                item.path("capabilities").forEach(t -> tags.add(t.asText()));
                models.add(new ModelInfo(
                    id,
                    executorId,
                    text(item, "display_name", text(item, "displayName", id)),
                    number(item, "cost_per_million_tokens", "costPerMillionTokens"),
                    (int) number(item, "context_window", "contextWindow"),
                    tags,
                    true));
            }
            return models;
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable model list from executor " + executorId, e);
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    private static double number(JsonNode node, String snake, String camel) {
        JsonNode value = node.hasNonNull(snake) ? node.get(snake) : node.get(camel);
        return value != null && value.isNumber() ? value.asDouble() : 0.0;
    }
}
