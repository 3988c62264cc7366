package com.modelrouter.decisionlog.repository;

import com.modelrouter.decisionlog.model.DecisionLogEntry;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface DecisionLogRepository extends ReactiveCrudRepository<DecisionLogEntry, Long> {

    Mono<DecisionLogEntry> findByDecisionId(String decisionId);

    Mono<Boolean> existsByDecisionId(String decisionId);

    /**
     * Writes the outcome only if none is recorded yet. Emits the number of rows changed:
     * 1 on the first write, 0 when the decision is unknown or already has an outcome.
     */
    @Modifying
    @Query("""
        UPDATE decision_record
           SET outcome_status      = :status,
               outcome_latency_ms  = :latencyMs,
               outcome_detail      = :detail,
               outcome_recorded_at = :recordedAt
         WHERE decision_id = :decisionId
           AND outcome_status IS NULL
        """)
    Mono<Integer> recordOutcomeOnce(String decisionId, String status, Long latencyMs,
                                    String detail, LocalDateTime recordedAt);

    @Query("SELECT * FROM decision_record ORDER BY decided_at DESC LIMIT :limit")
    Flux<DecisionLogEntry> findRecent(int limit);
}
