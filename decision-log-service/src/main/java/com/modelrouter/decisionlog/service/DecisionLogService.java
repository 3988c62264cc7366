package com.modelrouter.decisionlog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.DecisionRecord;
import com.modelrouter.common.model.QueryFeatures;
import com.modelrouter.common.model.ScoredCandidate;
import com.modelrouter.decisionlog.exception.DecisionConflictException;
import com.modelrouter.decisionlog.model.DecisionLogEntry;
import com.modelrouter.decisionlog.repository.DecisionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

/**
 * Append-only store of routing decisions.
 *
 * <ul>
 *   <li>{@link #append}       : inserts a record; a repeated decision id is a conflict</li>
 *   <li>{@link #recordOutcome}: conditional update, succeeds exactly once per decision</li>
 *   <li>{@link #find} / {@link #recent}: read side for offline analysis and retraining</li>
 * </ul>
 */
@Service
public class DecisionLogService {

    private static final Logger log = LoggerFactory.getLogger(DecisionLogService.class);

    static final int MAX_RECENT = 500;

    private final DecisionLogRepository repository;
    private final ObjectMapper objectMapper;

    public DecisionLogService(DecisionLogRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    public Mono<DecisionRecord> append(DecisionRecord record) {
        if (record.decisionId() == null || record.decisionId().isBlank()) {
            return Mono.error(new ConfigException("Decision record has no decision id"));
        }
        return repository.existsByDecisionId(record.decisionId())
            .flatMap(exists -> exists
                ? Mono.<DecisionLogEntry>error(new DecisionConflictException(
                    "Decision " + record.decisionId() + " is already logged"))
                : Mono.fromCallable(() -> toEntity(record)).flatMap(repository::save))
            .map(this::toRecord)
            .doOnNext(r -> log.info("Decision logged. decisionId={} parentDecisionId={} label={}/{} model={} traceId={}",
                                    r.decisionId(), r.parentDecisionId(), r.classification().domain(),
                                    r.classification().action(), r.selectedModelId(), r.requestId()));
    }

    /**
     * Attaches the outcome. Emits the updated record, empties when the decision is unknown,
     * and fails with {@link DecisionConflictException} when an outcome is already present.
     */
    public Mono<DecisionRecord> recordOutcome(String decisionId, DecisionOutcome outcome) {
        if (outcome == null || outcome.status() == null) {
            return Mono.error(new ConfigException("Outcome status is required"));
        }
        Instant recordedAt = outcome.recordedAt() != null ? outcome.recordedAt() : Instant.now();
        return repository.recordOutcomeOnce(decisionId, outcome.status().name(), outcome.latencyMs(),
                                            outcome.detail(), utc(recordedAt))
            .flatMap(updated -> {
                if (updated > 0) {
                    log.info("Outcome recorded. decisionId={} status={}", decisionId, outcome.status());
                    return repository.findByDecisionId(decisionId).map(this::toRecord);
                }
                return repository.existsByDecisionId(decisionId)
                    .flatMap(exists -> exists
                        ? Mono.<DecisionRecord>error(new DecisionConflictException(
                            "Decision " + decisionId + " already has an outcome"))
                        : Mono.<DecisionRecord>empty());
            });
    }

    public Mono<DecisionRecord> find(String decisionId) {
        return repository.findByDecisionId(decisionId).map(this::toRecord);
    }

    /** Most recent decisions first; {@code limit} is clamped to [1, {@value #MAX_RECENT}]. */
    public Flux<DecisionRecord> recent(int limit) {
        int bounded = Math.max(1, Math.min(MAX_RECENT, limit));
        return repository.findRecent(bounded).map(this::toRecord);
    }

    // ── mapping ───────────────────────────────────────────────────────────────

    private DecisionLogEntry toEntity(DecisionRecord record) throws JsonProcessingException {
        DecisionLogEntry e = new DecisionLogEntry();
        e.setDecisionId(record.decisionId());
        e.setParentDecisionId(record.parentDecisionId());
        e.setRequestId(record.requestId());
        e.setPrompt(record.prompt());
        if (record.classification() != null) {
            e.setDomain(record.classification().domain());
            e.setAction(record.classification().action());
            e.setClassificationFallback(record.classification().fallback());
        }
        e.setClassification(objectMapper.writeValueAsString(record.classification()));
        e.setFeatures(objectMapper.writeValueAsString(record.features()));
        e.setCandidates(objectMapper.writeValueAsString(record.candidates()));
        e.setExcludedModelIds(objectMapper.writeValueAsString(record.excludedModelIds()));
        e.setSelectedModelId(record.selectedModelId());
        e.setReceivedAt(utc(record.receivedAt()));
        e.setDecidedAt(utc(record.decidedAt()));
        return e;
    }

    private DecisionRecord toRecord(DecisionLogEntry e) {
        try {
            DecisionOutcome outcome = e.getOutcomeStatus() == null ? null : new DecisionOutcome(
                DecisionOutcome.Status.valueOf(e.getOutcomeStatus()), e.getOutcomeLatencyMs(),
                e.getOutcomeDetail(), instant(e.getOutcomeRecordedAt()));
            return new DecisionRecord(
                e.getDecisionId(), e.getParentDecisionId(), e.getRequestId(), e.getPrompt(),
                read(e.getClassification(), new TypeReference<Classification>() {}),
                read(e.getFeatures(), new TypeReference<QueryFeatures>() {}),
                read(e.getCandidates(), new TypeReference<List<ScoredCandidate>>() {}),
                read(e.getExcludedModelIds(), new TypeReference<Set<String>>() {}),
                e.getSelectedModelId(), instant(e.getReceivedAt()), instant(e.getDecidedAt()), outcome);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt decision row " + e.getDecisionId(), ex);
        }
    }

    private <T> T read(String json, TypeReference<T> type) throws JsonProcessingException {
        return json == null ? null : objectMapper.readValue(json, type);
    }

    private static LocalDateTime utc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant instant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }
}
