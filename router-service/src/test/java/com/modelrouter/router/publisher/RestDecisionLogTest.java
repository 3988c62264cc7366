package com.modelrouter.router.publisher;

import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.DecisionRecord;
import com.modelrouter.common.trace.RequestTrace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RestDecisionLogTest {

    private final List<ClientRequest> sent = new CopyOnWriteArrayList<>();

    private RestDecisionLog decisionLog(HttpStatus status) {
        WebClient client = WebClient.builder()
            .baseUrl("http://decision-log")
            .exchangeFunction(req -> {
                sent.add(req);
                return Mono.just(ClientResponse.create(status).build());
            })
            .build();
        return new RestDecisionLog(client);
    }

    private static DecisionRecord record() {
        return new DecisionRecord("d-1", null, "trace-9", "hello",
            Classification.of("general", "chat", 0.7, "greeting"), null, List.of(), Set.of(),
            "claude", Instant.EPOCH, Instant.EPOCH, null);
    }

    @Test
    @DisplayName("append posts the record with the trace header")
    void append() {
        decisionLog(HttpStatus.CREATED).append(record());

        assertEquals(1, sent.size());
        ClientRequest req = sent.get(0);
        assertEquals(HttpMethod.POST, req.method());
        assertEquals("/api/v1/decisions", req.url().getPath());
        assertEquals("trace-9", req.headers().getFirst(RequestTrace.TRACE_HEADER));
    }

    @Test
    @DisplayName("outcome is sent to the decision's outcome resource")
    void outcome() {
        decisionLog(HttpStatus.OK).recordOutcome("d-1",
            new DecisionOutcome(DecisionOutcome.Status.FAILURE, 30L, "upstream 500", Instant.EPOCH));

        assertEquals(1, sent.size());
        assertEquals(HttpMethod.PUT, sent.get(0).method());
        assertEquals("/api/v1/decisions/d-1/outcome", sent.get(0).url().getPath());
    }

    @Test
    @DisplayName("a rejected write is dropped without surfacing to the caller")
    void failureDropped() {
        assertDoesNotThrow(() -> decisionLog(HttpStatus.SERVICE_UNAVAILABLE).append(record()));
        assertEquals(1, sent.size());
    }
}
