package com.modelrouter.decisionlog.controller;

import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.DecisionRecord;
import com.modelrouter.common.trace.RequestTrace;
import com.modelrouter.decisionlog.service.DecisionLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/decisions")
public class DecisionLogController {

    private static final Logger log = LoggerFactory.getLogger(DecisionLogController.class);

    private final DecisionLogService decisionLogService;

    public DecisionLogController(DecisionLogService decisionLogService) {
        this.decisionLogService = decisionLogService;
    }

    @PostMapping
    public Mono<ResponseEntity<DecisionRecord>> append(
            @RequestBody DecisionRecord record,
            @RequestHeader(value = RequestTrace.TRACE_HEADER, required = false) String traceId) {
        return decisionLogService.append(record)
            .map(r -> ResponseEntity.status(HttpStatus.CREATED).body(r))
            .doOnError(e -> log.warn("Append failed. decisionId={} traceId={} reason={}",
                                     record.decisionId(), traceId, e.getMessage()));
    }

    @PutMapping("/{decisionId}/outcome")
    public Mono<ResponseEntity<DecisionRecord>> outcome(@PathVariable String decisionId,
                                                        @RequestBody DecisionOutcome outcome) {
        return decisionLogService.recordOutcome(decisionId, outcome)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{decisionId}")
    public Mono<ResponseEntity<DecisionRecord>> get(@PathVariable String decisionId) {
        return decisionLogService.find(decisionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/recent")
    public Flux<DecisionRecord> recent(@RequestParam(defaultValue = "50") int limit) {
        return decisionLogService.recent(limit);
    }
}
