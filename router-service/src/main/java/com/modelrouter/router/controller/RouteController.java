package com.modelrouter.router.controller;

import com.modelrouter.common.decision.DecisionLog;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.RouteRequest;
import com.modelrouter.common.model.RoutingDecision;
import com.modelrouter.common.trace.RequestTrace;
import com.modelrouter.router.dto.ReselectRequest;
import com.modelrouter.router.service.RouterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/route")
public class RouteController {

    private final RouterService routerService;
    private final DecisionLog decisionLog;

    public RouteController(RouterService routerService, DecisionLog decisionLog) {
        this.routerService = routerService;
        this.decisionLog   = decisionLog;
    }

    @PostMapping
    public Mono<RoutingDecision> route(
            @RequestBody RouteRequest request,
            @RequestHeader(value = RequestTrace.TRACE_HEADER, required = false) String traceHeader) {
        String traceId = RequestTrace.resolve(request.requestId(), traceHeader);
        return routerService.route(new RouteRequest(traceId, request.prompt(), request.context(),
                                                    request.excludedModelIds(), request.deadlineMs()));
    }

    @PostMapping("/reselect")
    public Mono<RoutingDecision> reselect(@RequestBody ReselectRequest request) {
        if (request.previous() == null || request.previous().candidates().isEmpty()) {
            return Mono.error(new ConfigException("Reselect needs the previous decision with its candidates"));
        }
        return Mono.fromCallable(() -> routerService.select(request.previous(), request.excludedModelIds()));
    }

    /** Gateway reports how the chosen backend call went; forwarded to the decision log. */
    @PostMapping("/{decisionId}/outcome")
    public ResponseEntity<Void> outcome(@PathVariable String decisionId, @RequestBody DecisionOutcome outcome) {
        if (outcome.status() == null) {
            throw new ConfigException("Outcome status is required");
        }
        DecisionOutcome stamped = outcome.recordedAt() != null ? outcome
            : new DecisionOutcome(outcome.status(), outcome.latencyMs(), outcome.detail(), Instant.now());
        decisionLog.recordOutcome(decisionId, stamped);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
