package com.modelrouter.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of one registered executor as of its last probe.
 *
 * <p>{@code unhealthySince} is null while the executor is healthy; the registry uses it to
 * decide when the liveness grace period has expired.
 */
public record Executor(
    String id,
    TransportKind transport,
    ExecutorDescriptor descriptor,
    List<String> capabilities,
    Liveness liveness,
    Instant lastProbedAt,
    Instant unhealthySince,
    List<ModelInfo> models
) {
    public Executor {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        models       = models == null ? List.of() : List.copyOf(models);
    }

    public static Executor registered(ExecutorDescriptor descriptor, TransportKind transport) {
        return new Executor(descriptor.id(), transport, descriptor, descriptor.capabilities(),
                            Liveness.UNKNOWN, null, null, List.of());
    }

    public boolean isHealthy() {
        return liveness == Liveness.HEALTHY;
    }
}
