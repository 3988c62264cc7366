package com.modelrouter.common.scoring;

import com.modelrouter.common.model.Candidate;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.QueryFeatures;
import com.modelrouter.common.model.ScoredCandidate;

import java.util.List;

/**
 * Strategy contract for ranking a merged, live candidate pool.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently from any number of routing requests</li>
 *   <li><b>Pure</b>     : no I/O, no reactive types; identical inputs give identical rankings</li>
 *   <li><b>Total</b>    : every input candidate appears exactly once in the output</li>
 * </ul>
 *
 * <p>Current implementation: {@link CostQualityScoringEngine}. Register a different bean in
 * {@code RouterConfig} to swap strategies without touching the router pipeline.
 */
public interface ScoringEngine {

    /**
     * Rank candidates best-first.
     *
     * @param classification the request's (possibly fallback) classification, cited in explanations
     * @param features       the request's extracted features
     * @param candidates     non-null list of live candidates; may be empty
     * @param checkpoint     the ability checkpoint in force for this request
     * @return ranked candidates, highest weighted score first
     */
    List<ScoredCandidate> score(Classification classification, QueryFeatures features,
                                List<Candidate> candidates, AbilityCheckpoint checkpoint);

    /**
     * Rewrites the explanations of an already-ranked list, keeping order and scores. Used
     * when a re-selection narrows a previous ranking so the text cites only the survivors.
     */
    List<ScoredCandidate> explain(Classification classification, List<ScoredCandidate> ranked);
}
