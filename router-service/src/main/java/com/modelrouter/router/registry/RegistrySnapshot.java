package com.modelrouter.router.registry;

import com.modelrouter.common.model.ModelInfo;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned view of every healthy model across all healthy executors.
 *
 * <p>Published by {@link ExecutorRegistry} through an atomic pointer swap; a routing call
 * reads exactly one snapshot and never observes a probe mid-update.
 */
public record RegistrySnapshot(long version, Instant takenAt, Map<String, ModelInfo> models) {

    public RegistrySnapshot {
        models = models == null ? Map.of() : Map.copyOf(models);
    }

    public static RegistrySnapshot empty(Instant takenAt) {
        return new RegistrySnapshot(0L, takenAt, Map.of());
    }

    public Optional<ModelInfo> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public boolean isLive(String modelId) {
        ModelInfo model = models.get(modelId);
        return model != null && model.healthy();
    }

    /** Models sorted by id, for stable JSON output. */
    public List<ModelInfo> healthyModels() {
        return models.values().stream()
            .sorted(Comparator.comparing(ModelInfo::id))
            .toList();
    }
}
