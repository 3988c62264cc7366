package com.modelrouter.router.logger;

import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.PolicyMatch;
import com.modelrouter.common.model.RoutingDecision;
import com.modelrouter.common.trace.RequestTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage-by-stage log of one routing call. Side effects only.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}</li>
 *   <li>{@link #CLASSIFIED}       classifier answered, or the fallback was substituted</li>
 *   <li>{@link #POLICY_RESOLVED}  candidate ids obtained from the policy store</li>
 *   <li>{@link #POOL_MERGED}      policy ids intersected with the live snapshot</li>
 *   <li>{@link #SCORED}</li>
 *   <li>{@link #SELECTED}</li>
 *   <li>{@link #DECISION_LOGGED}  record handed to the decision log</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (traceId read from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(RoutingFlowLogger.REQUEST_RECEIVED))
 * </pre>
 */
@Component
public class RoutingFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RoutingFlowLogger.class);

    public static final String REQUEST_RECEIVED = "REQUEST_RECEIVED";
    public static final String CLASSIFIED       = "CLASSIFIED";
    public static final String POLICY_RESOLVED  = "POLICY_RESOLVED";
    public static final String POOL_MERGED      = "POOL_MERGED";
    public static final String SCORED           = "SCORED";
    public static final String SELECTED         = "SELECTED";
    public static final String DECISION_LOGGED  = "DECISION_LOGGED";

    /**
     * Consumer for {@code doOnEach} that logs {@code stageName} on {@code onNext} only.
     * The traceId is bridged into MDC for the log call and removed afterwards.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = RequestTrace.current(signal.getContextView());
            RequestTrace.logWith(traceId, () ->
                log.info("[RoutingFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        RequestTrace.logWith(traceId, () ->
            log.info("[RoutingFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    public void logClassification(Classification classification, String traceId) {
        RequestTrace.logWith(traceId, () ->
            log.info("[RoutingFlow] stage={} label={} confidence={} fallback={} traceId={}",
                     CLASSIFIED, classification.label(), classification.confidence(),
                     classification.fallback(), traceId)
        );
    }

    public void logPolicy(PolicyMatch match, String traceId) {
        RequestTrace.logWith(traceId, () ->
            log.info("[RoutingFlow] stage={} matchLevel={} candidates={} traceId={}",
                     POLICY_RESOLVED, match.matchLevel(), match.candidateModelIds(), traceId)
        );
    }

    public void logPool(int policyCandidates, int live, long snapshotVersion, String traceId) {
        RequestTrace.logWith(traceId, () ->
            log.info("[RoutingFlow] stage={} policyCandidates={} live={} snapshotVersion={} traceId={}",
                     POOL_MERGED, policyCandidates, live, snapshotVersion, traceId)
        );
    }

    /** Logs {@link #SELECTED} with the winner and a compact view of the ranking. */
    public void logSelection(RoutingDecision decision, String traceId) {
        RequestTrace.logWith(traceId, () ->
            log.info("[RoutingFlow] stage={} decisionId={} parentDecisionId={} model={} executor={} "
                     + "confidence={} candidates={} latencyMs={} traceId={}",
                     SELECTED, decision.decisionId(), decision.parentDecisionId(),
                     decision.selectedModel().modelId(), decision.selectedModel().executorId(),
                     String.format("%.3f", decision.confidence()), decision.candidates().size(),
                     decision.latencyMs(), traceId)
        );
    }
}
