package com.modelrouter.common.decision;

import com.modelrouter.common.model.DecisionOutcome;
import com.modelrouter.common.model.DecisionRecord;

/**
 * Append-only sink for routing decisions, consumed offline for analysis and retraining.
 *
 * <p>Implementations MUST be non-blocking and fire-and-forget: a slow or unavailable sink
 * may drop or buffer entries but must never delay the routing caller, and must never retry
 * synchronously inline.
 */
public interface DecisionLog {

    /**
     * Append a fully-populated decision record.
     *
     * @param record the immutable decision; its outcome is null at this point
     */
    void append(DecisionRecord record);

    /**
     * Back-fill the outcome of a previously appended decision. The store accepts this once
     * per decision id.
     */
    void recordOutcome(String decisionId, DecisionOutcome outcome);
}
