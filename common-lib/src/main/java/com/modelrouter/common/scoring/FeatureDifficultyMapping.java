package com.modelrouter.common.scoring;

import com.modelrouter.common.model.QueryFeatures;

import java.util.List;

/**
 * Default {@link DifficultyMapping}: each known dimension reads one normalized feature,
 * scaled by {@code scale}. Unknown dimension names map to 0 (no difficulty contribution).
 *
 * <pre>
 *   length     ln(1 + tokens) / ln(1 + 8000), capped at 1
 *   complexity complexity
 *   code       0 without code, else 0.3 + codeLines / 60, capped at 1
 *   tools      1 when tool use is needed, else 0
 *   depth      conversationDepth / 20, capped at 1
 *   ambiguity  ambiguity
 * </pre>
 */
public class FeatureDifficultyMapping implements DifficultyMapping {

    public static final List<String> DEFAULT_DIMENSIONS =
        List.of("length", "complexity", "code", "tools", "depth", "ambiguity");

    private final double scale;

    public FeatureDifficultyMapping() {
        this(1.0);
    }

    public FeatureDifficultyMapping(double scale) {
        this.scale = scale;
    }

    @Override
    public double[] difficulty(QueryFeatures features, List<String> dimensions) {
        double[] vector = new double[dimensions.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = scale * component(features, dimensions.get(i));
        }
        return vector;
    }

    private double component(QueryFeatures f, String dimension) {
        return switch (dimension) {
            case "length"     -> Math.min(1.0, Math.log1p(f.estimatedTokens()) / Math.log1p(8000));
            case "complexity" -> f.complexity();
            case "code"       -> f.hasCode() ? Math.min(1.0, 0.3 + f.codeLineCount() / 60.0) : 0.0;
            case "tools"      -> f.toolUseNeeded() ? 1.0 : 0.0;
            case "depth"      -> Math.min(1.0, f.conversationDepth() / 20.0);
            case "ambiguity"  -> f.ambiguity();
            default           -> 0.0;
        };
    }
}
