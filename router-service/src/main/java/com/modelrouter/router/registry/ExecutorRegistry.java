package com.modelrouter.router.registry;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.Executor;
import com.modelrouter.common.model.ExecutorDescriptor;
import com.modelrouter.common.model.Liveness;
import com.modelrouter.common.model.ModelInfo;
import com.modelrouter.common.model.TransportKind;
import com.modelrouter.router.transport.ExecutorClient;
import com.modelrouter.router.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live inventory of executors and the models they serve.
 *
 * <p>Writers (registration, deregistration, probe results) mutate a {@link ConcurrentHashMap}
 * of entries and then publish a fresh {@link RegistrySnapshot}. Readers only ever call
 * {@link #snapshot()}, a single volatile read, so routing never waits on a probe.
 *
 * <p>Probe lifecycle per executor:
 * <pre>
 *   healthCheck() ── false/error/timeout ──► UNHEALTHY (models kept, healthy=false)
 *        │                                        │ failing for longer than grace period
 *        ▼ true                                   ▼
 *   listModels() ──► HEALTHY, models replaced    evicted
 * </pre>
 */
@Component
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private record Entry(Executor executor, ExecutorClient client) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicReference<RegistrySnapshot> current;
    private final TransportRegistry transports;
    private final Clock clock;
    private final Duration probeTimeout;
    private final Duration gracePeriod;

    public ExecutorRegistry(TransportRegistry transports,
                            Clock clock,
                            @Value("${router.registry.probe-timeout:2s}") Duration probeTimeout,
                            @Value("${router.registry.grace-period:60s}") Duration gracePeriod) {
        this.transports   = transports;
        this.clock        = clock;
        this.probeTimeout = probeTimeout;
        this.gracePeriod  = gracePeriod;
        this.current      = new AtomicReference<>(RegistrySnapshot.empty(clock.instant()));
    }

    // ── registration ─────────────────────────────────────────────────────────

    /**
     * Adds or replaces an executor. The new entry starts in {@link Liveness#UNKNOWN} and
     * contributes no models until its first successful probe.
     *
     * @throws ConfigException on a missing id, a missing or unknown transport, a transport
     *         with no shipped adapter, or a missing transport-specific field
     */
    public Executor register(ExecutorDescriptor descriptor) {
        if (descriptor == null || descriptor.id() == null || descriptor.id().isBlank()) {
            throw new ConfigException("Executor registration is missing an id");
        }
        if (descriptor.transport() == null || descriptor.transport().isBlank()) {
            throw new ConfigException("Executor " + descriptor.id() + " is missing a transport");
        }
        TransportKind kind = TransportKind.parse(descriptor.transport());
        if (kind == null) {
            throw new ConfigException("Executor " + descriptor.id()
                                      + " has unsupported transport " + descriptor.transport());
        }
        ExecutorClient client = transports.connect(kind, descriptor);

        Executor executor = Executor.registered(descriptor, kind);
        Entry previous = entries.put(descriptor.id(), new Entry(executor, client));
        publish();
        log.info("EXECUTOR_REGISTERED executorId={} transport={} replaced={}",
                 descriptor.id(), kind, previous != null);
        return executor;
    }

    /** Removes the executor and its models. Returns false when it was not registered. */
    public boolean deregister(String executorId) {
        Entry removed = entries.remove(executorId);
        if (removed == null) return false;
        publish();
        log.info("EXECUTOR_DEREGISTERED executorId={}", executorId);
        return true;
    }

    // ── probing ──────────────────────────────────────────────────────────────

    /** Probes every registered executor concurrently. Completes when all probes settle. */
    public Mono<Void> probeAll() {
        return Flux.fromIterable(List.copyOf(entries.keySet()))
            .flatMap(this::probe)
            .then();
    }

    /**
     * Probes one executor: health check, then model list, both inside one timeout.
     * Never errors; a failing probe is recorded on the executor. Emits the updated executor,
     * or empties when it is unknown or was evicted by this probe.
     */
    public Mono<Executor> probe(String executorId) {
        Entry entry = entries.get(executorId);
        if (entry == null) return Mono.empty();

        ExecutorClient client = entry.client();
        return client.healthCheck()
            .flatMap(healthy -> healthy
                ? client.listModels()
                : Mono.<List<ModelInfo>>error(new IllegalStateException("health check reported unhealthy")))
            .timeout(probeTimeout)
            .map(models -> Optional.ofNullable(applySuccess(executorId, models)))
            .onErrorResume(e -> Mono.just(Optional.ofNullable(applyFailure(executorId, e))))
            .flatMap(updated -> updated.map(Mono::just).orElseGet(Mono::empty));
    }

    private Executor applySuccess(String executorId, List<ModelInfo> discovered) {
        Instant now = clock.instant();
        Entry updated = entries.computeIfPresent(executorId, (id, e) -> {
            ExecutorDescriptor descriptor = e.executor().descriptor();
            List<ModelInfo> source = discovered == null || discovered.isEmpty()
                ? descriptor.fallbackModels()
                : discovered;
            List<ModelInfo> models = new ArrayList<>(source.size());
            for (ModelInfo m : source) {
                models.add(normalize(m, id, descriptor.capabilities(), true));
            }
            Executor executor = new Executor(id, e.executor().transport(), descriptor,
                descriptor.capabilities(), Liveness.HEALTHY, now, null, models);
            return new Entry(executor, e.client());
        });
        if (updated == null) return null;
        publish();
        log.debug("EXECUTOR_PROBED executorId={} liveness=HEALTHY models={}",
                  executorId, updated.executor().models().size());
        return updated.executor();
    }

    private Executor applyFailure(String executorId, Throwable error) {
        Instant now = clock.instant();
        boolean[] evicted = {false};
        Entry updated = entries.computeIfPresent(executorId, (id, e) -> {
            Executor old = e.executor();
            Instant since = old.unhealthySince() != null ? old.unhealthySince() : now;
            if (Duration.between(since, now).compareTo(gracePeriod) >= 0) {
                evicted[0] = true;
                return null;
            }
            List<ModelInfo> models = old.models().stream().map(m -> m.withHealthy(false)).toList();
            Executor executor = new Executor(id, old.transport(), old.descriptor(), old.capabilities(),
                                             Liveness.UNHEALTHY, now, since, models);
            return new Entry(executor, e.client());
        });
        publish();
        if (evicted[0]) {
            log.warn("EXECUTOR_EVICTED executorId={} gracePeriodSeconds={} reason={}",
                     executorId, gracePeriod.toSeconds(), error.getMessage());
            return null;
        }
        if (updated != null) {
            log.warn("EXECUTOR_UNHEALTHY executorId={} unhealthySince={} reason={}",
                     executorId, updated.executor().unhealthySince(), error.toString());
            return updated.executor();
        }
        return null;
    }

    private static ModelInfo normalize(ModelInfo model, String executorId,
                                       List<String> declaredCapabilities, boolean healthy) {
        Set<String> tags = new LinkedHashSet<>(model.capabilityTags());
        tags.addAll(declaredCapabilities);
        String displayName = model.displayName() == null ? model.id() : model.displayName();
        return new ModelInfo(model.id(), executorId, displayName, model.costPerMillionTokens(),
                             model.contextWindow(), List.copyOf(tags), healthy);
    }

    // ── reads ────────────────────────────────────────────────────────────────

    /** Current immutable snapshot of healthy models. Never blocks, never null. */
    public RegistrySnapshot snapshot() {
        return current.get();
    }

    /** All registered executors including unhealthy ones, sorted by id. */
    public List<Executor> executors() {
        return entries.values().stream()
            .map(Entry::executor)
            .sorted(Comparator.comparing(Executor::id))
            .toList();
    }

    // ── publication ──────────────────────────────────────────────────────────

    /**
     * Rebuilds and swaps the snapshot. Serialized so versions are strictly increasing and the
     * last writer always publishes a view that includes its own change.
     *
     * <p>The same model id served by two executors resolves to the cheaper one, then to the
     * lexically smaller executor id.
     */
    private synchronized void publish() {
        Map<String, ModelInfo> models = new HashMap<>();
        for (Entry entry : entries.values()) {
            Executor executor = entry.executor();
            if (!executor.isHealthy()) continue;
            for (ModelInfo model : executor.models()) {
                if (!model.healthy()) continue;
                models.merge(model.id(), model, ExecutorRegistry::preferred);
            }
        }
        RegistrySnapshot previous = current.get();
        current.set(new RegistrySnapshot(previous.version() + 1, clock.instant(), models));
    }

    private static ModelInfo preferred(ModelInfo a, ModelInfo b) {
        int byCost = Double.compare(a.costPerMillionTokens(), b.costPerMillionTokens());
        if (byCost != 0) return byCost < 0 ? a : b;
        return a.executorId().compareTo(b.executorId()) <= 0 ? a : b;
    }
}
