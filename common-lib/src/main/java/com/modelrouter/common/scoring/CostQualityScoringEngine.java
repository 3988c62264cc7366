package com.modelrouter.common.scoring;

import com.modelrouter.common.model.Candidate;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.ModelInfo;
import com.modelrouter.common.model.QueryFeatures;
import com.modelrouter.common.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * IRT-style cost-quality {@link ScoringEngine}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Difficulty vector {@code d} from the {@link DifficultyMapping}, once per request.</li>
 *   <li>Ability vector {@code a} from the checkpoint; a model without one gets the zero vector
 *       and its logit is reduced by {@code missingAbilityPenalty}.</li>
 *   <li>{@code p = sigmoid(Σ wᵢ·(aᵢ − dᵢ) − penalty)}, clamped into the open interval (0, 1).</li>
 *   <li>{@code costFactor = max(ε, 1 + costSensitivity · ln(1 + max(0, costPerMillion)))}.</li>
 *   <li>{@code weightedScore = p / costFactor}. A free model therefore scores exactly {@code p}.</li>
 * </ol>
 *
 * <h3>Ordering</h3>
 * <pre>
 *   weightedScore  descending
 *   policyRank     ascending   (declared preference in the matched policy)
 *   modelId        ascending   (lexical)
 * </pre>
 *
 * <p>This class is stateless and thread-safe.
 */
public class CostQualityScoringEngine implements ScoringEngine {

    public static final double DEFAULT_COST_SENSITIVITY = 0.25;
    public static final double DEFAULT_MISSING_ABILITY_PENALTY = 1.0;

    static final double COST_EPSILON = 1e-6;
    private static final double P_FLOOR = 1e-9;

    static final Comparator<ScoredCandidate> RANKING =
        Comparator.comparingDouble(ScoredCandidate::weightedScore).reversed()
            .thenComparingInt(ScoredCandidate::policyRank)
            .thenComparing(ScoredCandidate::modelId);

    private final DifficultyMapping difficultyMapping;
    private final double costSensitivity;
    private final double missingAbilityPenalty;

    public CostQualityScoringEngine() {
        this(new FeatureDifficultyMapping(), DEFAULT_COST_SENSITIVITY, DEFAULT_MISSING_ABILITY_PENALTY);
    }

    public CostQualityScoringEngine(DifficultyMapping difficultyMapping,
                                    double costSensitivity,
                                    double missingAbilityPenalty) {
        this.difficultyMapping     = difficultyMapping;
        this.costSensitivity       = Math.max(0.0, costSensitivity);
        this.missingAbilityPenalty = Math.max(0.0, missingAbilityPenalty);
    }

    @Override
    public List<ScoredCandidate> score(Classification classification, QueryFeatures features,
                                       List<Candidate> candidates, AbilityCheckpoint checkpoint) {
        if (candidates.isEmpty()) return List.of();

        double[] difficulty = difficultyMapping.difficulty(features, checkpoint.dimensions());
        double[] weights = checkpoint.weightVector();

        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            ModelInfo model = candidate.model();
            double[] ability = checkpoint.abilityOf(model.id()).orElse(null);
            boolean missing = ability == null;
            if (missing) ability = new double[weights.length];

            double logit = 0.0;
            for (int i = 0; i < weights.length; i++) {
                logit += weights[i] * (ability[i] - difficulty[i]);
            }
            if (missing) logit -= missingAbilityPenalty;

            double p = successProbability(logit);
            double score = p / costFactor(model.costPerMillionTokens());
            scored.add(new ScoredCandidate(model.id(), model.executorId(), model.costPerMillionTokens(),
                                           candidate.policyRank(), p, score, missing, null));
        }
        scored.sort(RANKING);
        return explain(classification, scored);
    }

    double costFactor(double costPerMillionTokens) {
        double cost = Double.isNaN(costPerMillionTokens) ? 0.0 : Math.max(0.0, costPerMillionTokens);
        return Math.max(COST_EPSILON, 1.0 + costSensitivity * Math.log1p(cost));
    }

    static double successProbability(double logit) {
        double p = 1.0 / (1.0 + Math.exp(-logit));
        return Math.max(P_FLOOR, Math.min(1.0 - P_FLOOR, p));
    }

    // ── explanations ───────────────────────────────────────────────────────

    @Override
    public List<ScoredCandidate> explain(Classification classification, List<ScoredCandidate> ranked) {
        if (ranked.isEmpty()) return List.of();
        String header = String.format(Locale.ROOT, "%s (confidence %.2f%s)",
            classification.label(), classification.confidence(),
            classification.fallback() ? ", fallback" : "");
        ScoredCandidate leader = ranked.get(0);
        ScoredCandidate runnerUp = ranked.size() > 1 ? ranked.get(1) : null;

        List<ScoredCandidate> explained = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ScoredCandidate c = ranked.get(i);
            StringBuilder sb = new StringBuilder(header)
                .append(": ").append(describe(c))
                .append(String.format(Locale.ROOT, " rank %d/%d", i + 1, ranked.size()));
            if (c.abilityMissing()) sb.append(" [no ability data, penalized]");
            if (i == 0 && runnerUp != null) {
                sb.append(" beats ").append(describe(runnerUp));
            } else if (i > 0) {
                sb.append(" trails ").append(describe(leader));
            }
            explained.add(c.withExplanation(sb.toString()));
        }
        return explained;
    }

    static String describe(ScoredCandidate c) {
        return String.format(Locale.ROOT, "%s (p=%.3f, cost=%.2f/M, score=%.4f)",
            c.modelId(), c.successProbability(), c.costPerMillionTokens(), c.weightedScore());
    }
}
