package com.modelrouter.common.scoring;

import com.modelrouter.common.model.Candidate;
import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.ModelInfo;
import com.modelrouter.common.model.QueryFeatures;
import com.modelrouter.common.model.ScoredCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link CostQualityScoringEngine}.
 */
class CostQualityScoringEngineTest {

    private static final List<String> DIMS = FeatureDifficultyMapping.DEFAULT_DIMENSIONS;
    private static final Classification CODEGEN =
        Classification.of("programming", "code-generation", 0.9, "asks for code");
    private static final QueryFeatures FEATURES =
        new QueryFeatures(120, 0.4, true, 10, List.of("java"), false, 2, 0.2);

    private final CostQualityScoringEngine engine = new CostQualityScoringEngine();

    private static Candidate candidate(String id, double cost, int rank) {
        return new Candidate(new ModelInfo(id, "exec-" + id, id, cost, 100_000, List.of(), true), rank);
    }

    private static List<Double> vector(double v) {
        return List.of(v, v, v, v, v, v);
    }

    private static AbilityCheckpoint checkpoint(Map<String, List<Double>> abilities) {
        return new AbilityCheckpoint("t", DIMS, null, abilities);
    }

    // ── cost handling ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("cost factor")
    class CostTests {

        @Test
        @DisplayName("cost 0 → weighted score equals success probability exactly")
        void freeModel() {
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("local", 0.0, 0)), checkpoint(Map.of("local", vector(0.6))));

            ScoredCandidate c = scored.get(0);
            assertEquals(c.successProbability(), c.weightedScore());
        }

        @Test
        @DisplayName("negative and NaN costs are treated as free")
        void negativeCost() {
            assertEquals(1.0, engine.costFactor(-4.0));
            assertEquals(1.0, engine.costFactor(Double.NaN));
        }

        @Test
        @DisplayName("zero sensitivity → cost never matters")
        void zeroSensitivity() {
            CostQualityScoringEngine blind = new CostQualityScoringEngine(new FeatureDifficultyMapping(), 0.0, 1.0);
            assertEquals(1.0, blind.costFactor(1_000.0));
        }

        @Test
        @DisplayName("same ability, higher cost → lower score")
        void pricierLoses() {
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("gpt-4", 5.0, 0), candidate("claude", 3.0, 1)),
                checkpoint(Map.of("gpt-4", vector(0.7), "claude", vector(0.7))));

            assertEquals("claude", scored.get(0).modelId());
            assertEquals(scored.get(0).successProbability(), scored.get(1).successProbability());
        }
    }

    // ── ordering ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ranking")
    class RankingTests {

        @Test
        @DisplayName("higher ability can outweigh higher cost")
        void abilityWins() {
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("strong", 3.0, 1), candidate("weak", 0.5, 0)),
                checkpoint(Map.of("strong", vector(2.0), "weak", vector(-1.0))));

            assertEquals("strong", scored.get(0).modelId());
        }

        @Test
        @DisplayName("equal scores → policy rank, then model id")
        void tieBreaks() {
            AbilityCheckpoint cp = checkpoint(Map.of("b", vector(0.5), "a", vector(0.5), "c", vector(0.5)));
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("c", 1.0, 0), candidate("b", 1.0, 1), candidate("a", 1.0, 1)), cp);

            assertEquals(List.of("c", "a", "b"), scored.stream().map(ScoredCandidate::modelId).toList());
        }

        @Test
        @DisplayName("strictly higher score always ranks strictly higher")
        void rankConsistency() {
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("m1", 8.0, 2), candidate("m2", 0.0, 0), candidate("m3", 2.0, 1)),
                checkpoint(Map.of("m1", vector(1.5), "m2", vector(0.1), "m3", vector(0.9))));

            for (int i = 0; i < scored.size(); i++) {
                for (int j = i + 1; j < scored.size(); j++) {
                    assertFalse(scored.get(j).weightedScore() > scored.get(i).weightedScore());
                }
            }
        }

        @Test
        @DisplayName("empty candidate list → empty ranking")
        void empty() {
            assertTrue(engine.score(CODEGEN, FEATURES, List.of(), checkpoint(Map.of())).isEmpty());
        }
    }

    // ── missing abilities and explanations ───────────────────────────────

    @Nested
    @DisplayName("missing ability data")
    class MissingTests {

        @Test
        @DisplayName("model without a vector is kept, flagged and penalized")
        void penalized() {
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("known", 1.0, 0), candidate("unknown", 1.0, 1)),
                checkpoint(Map.of("known", vector(0.0))));

            assertEquals(2, scored.size());
            ScoredCandidate unknown = scored.stream().filter(c -> c.modelId().equals("unknown")).findFirst().orElseThrow();
            ScoredCandidate known = scored.stream().filter(c -> c.modelId().equals("known")).findFirst().orElseThrow();
            assertTrue(unknown.abilityMissing());
            assertFalse(known.abilityMissing());
            assertTrue(unknown.successProbability() < known.successProbability());
            assertTrue(unknown.explanation().contains("no ability data"));
        }

        @Test
        @DisplayName("success probability stays strictly inside (0, 1)")
        void clamped() {
            assertTrue(CostQualityScoringEngine.successProbability(1_000) < 1.0);
            assertTrue(CostQualityScoringEngine.successProbability(-1_000) > 0.0);
        }

        @Test
        @DisplayName("explanations cite the classification and the compared numbers")
        void explanations() {
            List<ScoredCandidate> scored = engine.score(CODEGEN, FEATURES,
                List.of(candidate("gpt-4", 5.0, 0), candidate("claude", 3.0, 1)),
                checkpoint(Map.of("gpt-4", vector(0.7), "claude", vector(0.7))));

            String leader = scored.get(0).explanation();
            assertTrue(leader.startsWith("programming/code-generation (confidence 0.90)"));
            assertTrue(leader.contains("claude (p="));
            assertTrue(leader.contains("beats gpt-4"));
            assertTrue(scored.get(1).explanation().contains("trails claude"));
        }
    }
}
