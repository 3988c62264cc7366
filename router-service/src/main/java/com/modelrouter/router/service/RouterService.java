package com.modelrouter.router.service;

import com.modelrouter.common.decision.DecisionLog;
import com.modelrouter.common.exception.NoEligibleCandidatesException;
import com.modelrouter.common.exception.PolicyUnavailableException;
import com.modelrouter.common.exception.RoutingCancelledException;
import com.modelrouter.common.feature.FeatureExtractor;
import com.modelrouter.common.model.Candidate;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.DecisionRecord;
import com.modelrouter.common.model.ModelInfo;
import com.modelrouter.common.model.PolicyMatch;
import com.modelrouter.common.model.QueryFeatures;
import com.modelrouter.common.model.RouteRequest;
import com.modelrouter.common.model.RoutingDecision;
import com.modelrouter.common.model.ScoredCandidate;
import com.modelrouter.common.scoring.ScoringEngine;
import com.modelrouter.common.trace.RequestTrace;
import com.modelrouter.router.classifier.TaskClassifier;
import com.modelrouter.router.logger.RoutingFlowLogger;
import com.modelrouter.router.policy.PolicyStore;
import com.modelrouter.router.registry.ExecutorRegistry;
import com.modelrouter.router.registry.RegistrySnapshot;
import com.modelrouter.router.scoring.AbilityCheckpointHolder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The routing pipeline:
 * <pre>
 *   Classify → LookupPolicy → Merge → Score → Select → Log → Return
 * </pre>
 *
 * <p>Holds no per-request state; everything a call needs is read from one registry snapshot,
 * one checkpoint and one policy lookup. Only classification and the policy fetch suspend on
 * I/O, and both sit inside the caller's deadline.
 */
@Service
public class RouterService {

    private static final Logger log = LoggerFactory.getLogger(RouterService.class);

    private final TaskClassifier taskClassifier;
    private final PolicyStore policyStore;
    private final ExecutorRegistry executorRegistry;
    private final ScoringEngine scoringEngine;
    private final AbilityCheckpointHolder checkpointHolder;
    private final DecisionLog decisionLog;
    private final RoutingFlowLogger flowLogger;
    private final Clock clock;
    private final String fallbackDomain;
    private final String fallbackAction;

    public RouterService(TaskClassifier taskClassifier,
                         PolicyStore policyStore,
                         ExecutorRegistry executorRegistry,
                         ScoringEngine scoringEngine,
                         AbilityCheckpointHolder checkpointHolder,
                         DecisionLog decisionLog,
                         RoutingFlowLogger flowLogger,
                         Clock clock,
                         @Value("${router.classifier.fallback-domain:general}") String fallbackDomain,
                         @Value("${router.classifier.fallback-action:chat}") String fallbackAction) {
        this.taskClassifier   = taskClassifier;
        this.policyStore      = policyStore;
        this.executorRegistry = executorRegistry;
        this.scoringEngine    = scoringEngine;
        this.checkpointHolder = checkpointHolder;
        this.decisionLog      = decisionLog;
        this.flowLogger       = flowLogger;
        this.clock            = clock;
        this.fallbackDomain   = fallbackDomain;
        this.fallbackAction   = fallbackAction;
    }

    /** Routes with the request's own deadline, if any. */
    public Mono<RoutingDecision> route(RouteRequest request) {
        return route(request, Mono.never());
    }

    /**
     * Routes a request, abandoning the pipeline when {@code cancellation} signals or the
     * request deadline passes. Either way the caller gets {@link RoutingCancelledException}
     * and nothing from the abandoned fetches is cached.
     */
    public Mono<RoutingDecision> route(RouteRequest request, Publisher<?> cancellation) {
        String traceId = RequestTrace.ensure(request.requestId());
        Instant receivedAt = clock.instant();
        QueryFeatures features = FeatureExtractor.extract(request.prompt(), request.context());

        Mono<RoutingDecision> pipeline = Mono.just(request)
            .doOnEach(flowLogger.stage(RoutingFlowLogger.REQUEST_RECEIVED))
            .flatMap(r -> classify(r, traceId))
            .flatMap(classification -> lookupPolicy(classification, traceId)
                .map(match -> decide(traceId, request, classification, features, match, receivedAt)));

        if (request.deadlineMs() != null && request.deadlineMs() > 0) {
            Duration deadline = Duration.ofMillis(request.deadlineMs());
            pipeline = pipeline.timeout(deadline, Mono.error(() -> new RoutingCancelledException(
                "Routing deadline of " + deadline.toMillis() + "ms exceeded", null)));
        }
        pipeline = pipeline
            .takeUntilOther(cancellation)
            .switchIfEmpty(Mono.error(() -> new RoutingCancelledException("Routing cancelled by caller", null)));

        return RequestTrace.bind(pipeline, traceId);
    }

    /**
     * Picks the next-ranked model from a previous decision's ranking without reclassifying.
     * Exclusions accumulate: everything excluded by {@code previous} stays excluded. Liveness is
     * rechecked against the current snapshot. The new decision is logged with
     * {@code previous} as its parent.
     *
     * @throws NoEligibleCandidatesException when no ranked candidate survives
     */
    public RoutingDecision select(RoutingDecision previous, Set<String> excludedModelIds) {
        Instant receivedAt = clock.instant();
        Set<String> excluded = new LinkedHashSet<>(previous.excludedModelIds());
        if (excludedModelIds != null) excluded.addAll(excludedModelIds);

        RegistrySnapshot snapshot = executorRegistry.snapshot();
        List<ScoredCandidate> remaining = previous.candidates().stream()
            .filter(c -> !excluded.contains(c.modelId()))
            .filter(c -> snapshot.isLive(c.modelId()))
            .toList();
        if (remaining.isEmpty()) {
            throw new NoEligibleCandidatesException("No candidate left for " + previous.classification().label()
                + " after excluding " + excluded);
        }

        ScoredCandidate chosen = scoringEngine.explain(previous.classification(), remaining).get(0);
        String reasoning = chosen.explanation() + "; reselected after excluding " + excluded;
        Instant decidedAt = clock.instant();
        RoutingDecision decision = new RoutingDecision(
            UUID.randomUUID().toString(), previous.decisionId(), previous.requestId(),
            chosen, previous.candidates(), previous.classification(), previous.features(),
            excluded, Duration.between(receivedAt, decidedAt).toMillis(),
            chosen.successProbability(), reasoning, decidedAt);

        flowLogger.logSelection(decision, previous.requestId());
        appendRecord(decision, null, receivedAt);
        return decision;
    }

    // ── stages ───────────────────────────────────────────────────────────────

    private Mono<Classification> classify(RouteRequest request, String traceId) {
        return taskClassifier.classify(request.prompt(), request.context())
            .onErrorResume(e -> {
                log.warn("Classifier unavailable, using fallback. traceId={} reason={}", traceId, e.getMessage());
                return Mono.just(Classification.fallback(fallbackDomain, fallbackAction, e.getMessage()));
            })
            .switchIfEmpty(Mono.fromSupplier(() ->
                Classification.fallback(fallbackDomain, fallbackAction, "classifier returned nothing")))
            .doOnNext(c -> flowLogger.logClassification(c, traceId));
    }

    private Mono<PolicyMatch> lookupPolicy(Classification classification, String traceId) {
        return policyStore.getCandidates(classification.domain(), classification.action())
            .switchIfEmpty(Mono.fromSupplier(() ->
                PolicyMatch.none(classification.domain(), classification.action())))
            .onErrorMap(PolicyUnavailableException.class, e -> new NoEligibleCandidatesException(
                "Policy store unavailable for " + classification.label(), e))
            .doOnNext(match -> flowLogger.logPolicy(match, traceId));
    }

    private RoutingDecision decide(String traceId, RouteRequest request, Classification classification,
                                   QueryFeatures features, PolicyMatch match, Instant receivedAt) {
        RegistrySnapshot snapshot = executorRegistry.snapshot();
        List<Candidate> pool = merge(match, snapshot, request.excludedModelIds());
        flowLogger.logPool(match.candidateModelIds().size(), pool.size(), snapshot.version(), traceId);
        if (pool.isEmpty()) {
            throw new NoEligibleCandidatesException("No live candidate for " + classification.label()
                + " (policy " + match.matchLevel() + ", candidates " + match.candidateModelIds()
                + ", excluded " + request.excludedModelIds() + ")");
        }

        List<ScoredCandidate> ranked = scoringEngine.score(classification, features, pool, checkpointHolder.current());
        flowLogger.logWithTraceId(RoutingFlowLogger.SCORED, traceId);
        for (ScoredCandidate c : ranked) {
            if (c.abilityMissing()) {
                log.warn("SCORING_DATA_MISSING modelId={} checkpointVersion={} traceId={}",
                         c.modelId(), checkpointHolder.current().version(), traceId);
            }
        }

        ScoredCandidate selected = ranked.get(0);
        Instant decidedAt = clock.instant();
        RoutingDecision decision = new RoutingDecision(
            UUID.randomUUID().toString(), null, traceId, selected, ranked, classification, features,
            request.excludedModelIds(), Duration.between(receivedAt, decidedAt).toMillis(),
            selected.successProbability(), selected.explanation(), decidedAt);

        flowLogger.logSelection(decision, traceId);
        appendRecord(decision, request.prompt(), receivedAt);
        return decision;
    }

    /**
     * Intersects the policy's ordered ids with the live snapshot. Each survivor keeps its
     * position in the policy list as its rank; excluded and duplicate ids are dropped.
     */
    static List<Candidate> merge(PolicyMatch match, RegistrySnapshot snapshot, Set<String> excluded) {
        List<Candidate> pool = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<String> ids = match.candidateModelIds();
        for (int rank = 0; rank < ids.size(); rank++) {
            String id = ids.get(rank);
            if (!seen.add(id) || excluded.contains(id)) continue;
            Optional<ModelInfo> model = snapshot.find(id);
            if (model.isPresent() && model.get().healthy()) {
                pool.add(new Candidate(model.get(), rank));
            }
        }
        return pool;
    }

    private void appendRecord(RoutingDecision decision, String prompt, Instant receivedAt) {
        try {
            decisionLog.append(DecisionRecord.of(decision, prompt, receivedAt));
            flowLogger.logWithTraceId(RoutingFlowLogger.DECISION_LOGGED, decision.requestId());
        } catch (RuntimeException e) {
            log.warn("Decision log rejected record (dropped). decisionId={} traceId={}",
                     decision.decisionId(), decision.requestId(), e);
        }
    }
}
