package com.modelrouter.common.scoring;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.QueryFeatures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AbilityCheckpointTest {

    @Test
    @DisplayName("weights default to a uniform vector")
    void uniformWeights() {
        AbilityCheckpoint cp = new AbilityCheckpoint("v1", List.of("a", "b", "c", "d"), null, Map.of());
        assertArrayEquals(new double[] {0.25, 0.25, 0.25, 0.25}, cp.weightVector());
    }

    @Test
    @DisplayName("weight count must match dimensions")
    void weightMismatch() {
        assertThrows(ConfigException.class,
            () -> new AbilityCheckpoint("v1", List.of("a", "b"), List.of(1.0), Map.of()));
    }

    @Test
    @DisplayName("ability vector length must match dimensions")
    void abilityMismatch() {
        assertThrows(ConfigException.class,
            () -> new AbilityCheckpoint("v1", List.of("a", "b"), null, Map.of("m1", List.of(0.1))));
    }

    @Test
    @DisplayName("no dimensions → ConfigException")
    void noDimensions() {
        assertThrows(ConfigException.class, () -> new AbilityCheckpoint("v1", List.of(), null, Map.of()));
    }

    @Test
    @DisplayName("abilityOf() returns a copy, absent models are empty")
    void lookup() {
        AbilityCheckpoint cp = new AbilityCheckpoint("v1", List.of("a"), null, Map.of("m1", List.of(0.4)));
        assertArrayEquals(new double[] {0.4}, cp.abilityOf("m1").orElseThrow());
        assertTrue(cp.abilityOf("m2").isEmpty());
    }

    @Test
    @DisplayName("default difficulty mapping reads features per dimension and zeroes unknown names")
    void difficultyMapping() {
        QueryFeatures f = new QueryFeatures(0, 0.5, true, 6, List.of(), true, 10, 0.3);
        double[] d = new FeatureDifficultyMapping().difficulty(f,
            List.of("length", "complexity", "code", "tools", "depth", "ambiguity", "mystery"));

        assertArrayEquals(new double[] {0.0, 0.5, 0.4, 1.0, 0.5, 0.3, 0.0}, d, 1e-9);
    }
}
