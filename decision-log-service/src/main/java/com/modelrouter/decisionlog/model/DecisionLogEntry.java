package com.modelrouter.decisionlog.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted routing decision. Decision columns are written once on insert; the
 * {@code outcome*} columns stay null until the single outcome back-fill.
 *
 * Column mapping (R2DBC snake_case convention):
 *   decisionId             → decision_id (unique)
 *   parentDecisionId       → parent_decision_id
 *   classificationFallback → classification_fallback
 *   selectedModelId        → selected_model_id
 *   outcomeStatus          → outcome_status
 *
 * classification / features / candidates / excludedModelIds: JSON-serialised
 * All timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("decision_record")
public class DecisionLogEntry {

    @Id
    private Long id;

    private String decisionId;

    private String parentDecisionId;

    private String requestId;

    private String prompt;

    private String domain;

    private String action;

    private boolean classificationFallback;

    /** JSON-serialised {@code Classification} */
    private String classification;

    /** JSON-serialised {@code QueryFeatures} */
    private String features;

    /** JSON-serialised {@code List<ScoredCandidate>}, ranked */
    private String candidates;

    /** JSON-serialised {@code Set<String>} */
    private String excludedModelIds;

    private String selectedModelId;

    private LocalDateTime receivedAt;

    private LocalDateTime decidedAt;

    // ── outcome (back-filled once) ──

    private String outcomeStatus;

    private Long outcomeLatencyMs;

    private String outcomeDetail;

    private LocalDateTime outcomeRecordedAt;
}
