package com.modelrouter.router.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ClassificationTimeoutException;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.exception.MalformedClassificationException;
import com.modelrouter.common.model.Classification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RemoteTaskClassifierTest {

    private static final String URL = "http://classifier.local";

    private static RemoteTaskClassifier classifierAnswering(String body, Duration delay) {
        WebClient client = WebClient.builder()
            .baseUrl(URL)
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build())
                .delayElement(delay))
            .build();
        return new RemoteTaskClassifier(client, new ObjectMapper(), URL, Duration.ofMillis(200));
    }

    @Test
    @DisplayName("well-formed answer → classification, not marked fallback")
    void wellFormed() {
        Classification c = classifierAnswering(
            "{\"domain\":\"programming\",\"action\":\"code-generation\",\"confidence\":0.92,\"reasoning\":\"asks for code\"}",
            Duration.ZERO).classify("write a parser", List.of()).block();

        assertNotNull(c);
        assertEquals("programming/code-generation", c.label());
        assertEquals(0.92, c.confidence());
        assertFalse(c.fallback());
    }

    @Test
    @DisplayName("answer slower than the timeout → ClassificationTimeoutException")
    void timeout() {
        RemoteTaskClassifier classifier = classifierAnswering(
            "{\"domain\":\"programming\",\"action\":\"debug\",\"confidence\":0.5}", Duration.ofSeconds(2));

        assertThrows(ClassificationTimeoutException.class, () -> classifier.classify("hi", List.of()).block());
    }

    @Test
    @DisplayName("missing action → MalformedClassificationException")
    void missingAction() {
        RemoteTaskClassifier classifier = classifierAnswering(
            "{\"domain\":\"programming\",\"confidence\":0.5}", Duration.ZERO);

        assertThrows(MalformedClassificationException.class, () -> classifier.classify("hi", List.of()).block());
    }

    @Test
    @DisplayName("confidence outside [0, 1] → MalformedClassificationException")
    void confidenceOutOfRange() {
        RemoteTaskClassifier classifier = classifierAnswering(
            "{\"domain\":\"math\",\"action\":\"proof\",\"confidence\":7}", Duration.ZERO);

        assertThrows(MalformedClassificationException.class, () -> classifier.classify("hi", List.of()).block());
    }

    @Test
    @DisplayName("no base URL configured → ConfigException without any call")
    void notConfigured() {
        RemoteTaskClassifier classifier = new RemoteTaskClassifier(
            WebClient.builder().build(), new ObjectMapper(), "", Duration.ofMillis(200));

        assertThrows(ConfigException.class, () -> classifier.classify("hi", List.of()).block());
    }
}
