package com.modelrouter.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelrouter.common.exception.ConfigException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned, read-only ability parameters for the scoring engine.
 *
 * <ul>
 *   <li>{@code dimensions}: ordered latent dimension names shared by ability and difficulty vectors</li>
 *   <li>{@code weights}   : per-dimension weight of the dot product, same length as {@code dimensions}</li>
 *   <li>{@code abilities} : model id → ability vector, each the same length as {@code dimensions}</li>
 * </ul>
 *
 * <p>Loaded once from an external artifact and replaced wholesale on reload; never mutated.
 * A shape mismatch is a {@link ConfigException} at load time, never a scoring-time failure.
 */
public record AbilityCheckpoint(
    @JsonProperty("version") String version,
    @JsonProperty("dimensions") List<String> dimensions,
    @JsonProperty("weights") List<Double> weights,
    @JsonProperty("abilities") Map<String, List<Double>> abilities
) {
    public AbilityCheckpoint {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new ConfigException("Ability checkpoint " + version + " declares no dimensions");
        }
        dimensions = List.copyOf(dimensions);
        int size = dimensions.size();
        if (weights == null) {
            weights = Collections.nCopies(size, 1.0 / size);
        } else if (weights.size() != size) {
            throw new ConfigException("Ability checkpoint " + version + " has " + weights.size()
                                      + " weights for " + size + " dimensions");
        }
        weights = List.copyOf(weights);
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        if (abilities != null) {
            for (Map.Entry<String, List<Double>> e : abilities.entrySet()) {
                if (e.getValue() == null || e.getValue().size() != size) {
                    throw new ConfigException("Ability vector for model " + e.getKey()
                                              + " does not match " + size + " dimensions");
                }
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        abilities = Map.copyOf(copy);
    }

    /** Checkpoint with no learned abilities: every candidate scores with the missing-ability penalty. */
    public static AbilityCheckpoint empty(List<String> dimensions) {
        return new AbilityCheckpoint("empty", dimensions, null, Map.of());
    }

    public Optional<double[]> abilityOf(String modelId) {
        List<Double> vector = abilities.get(modelId);
        if (vector == null) return Optional.empty();
        return Optional.of(vector.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public double[] weightVector() {
        return weights.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
