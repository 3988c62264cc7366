package com.modelrouter.router.publisher;

import com.modelrouter.common.decision.DecisionLog;
import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.DecisionRecord;
import com.modelrouter.common.trace.RequestTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based {@link DecisionLog}: posts records to decision-log-service, fire-and-forget.
 * A failed write is logged at WARN and dropped; the routing caller is never delayed.
 */
@Component
public class RestDecisionLog implements DecisionLog {

    private static final Logger log = LoggerFactory.getLogger(RestDecisionLog.class);

    private final WebClient decisionLogClient;

    public RestDecisionLog(@Qualifier("decisionLogClient") WebClient decisionLogClient) {
        this.decisionLogClient = decisionLogClient;
    }

    @Override
    public void append(DecisionRecord record) {
        decisionLogClient.post()
            .uri("/api/v1/decisions")
            .header(RequestTrace.TRACE_HEADER, record.requestId())
            .bodyValue(record)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.debug("Decision record appended. decisionId={} status={}",
                                 record.decisionId(), r.getStatusCode()),
                err -> log.warn("Decision record append failed (dropped). decisionId={} traceId={}",
                                record.decisionId(), record.requestId(), err)
            );
    }

    @Override
    public void recordOutcome(String decisionId, DecisionOutcome outcome) {
        decisionLogClient.put()
            .uri("/api/v1/decisions/{id}/outcome", decisionId)
            .bodyValue(outcome)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Decision outcome recorded. decisionId={} status={}",
                                decisionId, outcome.status()),
                err -> log.warn("Decision outcome write failed (dropped). decisionId={} reason={}",
                                decisionId, err.getMessage())
            );
    }
}
