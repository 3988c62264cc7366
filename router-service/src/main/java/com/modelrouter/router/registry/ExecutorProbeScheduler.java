package com.modelrouter.router.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.ExecutorDescriptor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Seeds the {@link ExecutorRegistry} from the bootstrap resource and keeps it fresh with a
 * background probe loop:
 * <pre>
 *   probeAll() → delay(probeInterval) → probeAll() → ...
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono}; its terminal {@code subscribe()} schedules the next
 * one. A failing cycle is logged and the loop carries on, so a misbehaving executor can
 * never stop probing of the others.
 */
@Component
public class ExecutorProbeScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorProbeScheduler.class);

    private final ExecutorRegistry registry;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final AtomicReference<Disposable> pending = new AtomicReference<>();
    private volatile boolean running;

    @Value("${router.registry.bootstrap:}")
    private String bootstrapLocation;

    @Value("${router.registry.probe-interval:5s}")
    private Duration probeInterval;

    public ExecutorProbeScheduler(ExecutorRegistry registry, ResourceLoader resourceLoader,
                                  ObjectMapper objectMapper) {
        this.registry       = registry;
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    @PostConstruct
    public void start() {
        int registered = bootstrap(bootstrapLocation);
        running = true;
        log.info("Executor probe loop started. bootstrapped={} probeIntervalMs={}",
                 registered, probeInterval.toMillis());
        scheduleNextCycle(Duration.ZERO);
    }

    @PreDestroy
    public void stop() {
        running = false;
        Disposable d = pending.getAndSet(null);
        if (d != null) d.dispose();
        log.info("Executor probe loop stopped.");
    }

    /** The executor set is read when the delay elapses, so late registrations join this cycle. */
    void scheduleNextCycle(Duration delay) {
        if (!running) return;
        Disposable next = Mono.delay(delay)
            .then(Mono.defer(registry::probeAll))
            .subscribe(
                ignored -> { },
                err -> {
                    log.error("Probe cycle failed, rescheduling. probeIntervalMs={}", probeInterval.toMillis(), err);
                    scheduleNextCycle(probeInterval);
                },
                () -> {
                    log.debug("Probe cycle complete. snapshotVersion={} models={}",
                              registry.snapshot().version(), registry.snapshot().models().size());
                    scheduleNextCycle(probeInterval);
                });
        pending.set(next);
    }

    /**
     * Registers every executor listed in a JSON array resource. Entries that fail validation
     * are logged and skipped; an unreadable file fails startup.
     *
     * @return the number of executors registered
     */
    int bootstrap(String location) {
        if (location == null || location.isBlank()) return 0;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Executor bootstrap resource not found. location={}", location);
            return 0;
        }
        List<ExecutorDescriptor> descriptors;
        try (InputStream in = resource.getInputStream()) {
            descriptors = objectMapper.readValue(in, new TypeReference<List<ExecutorDescriptor>>() {});
        } catch (IOException e) {
            throw new ConfigException("Unreadable executor bootstrap " + location, e);
        }
        int count = 0;
        for (ExecutorDescriptor descriptor : descriptors) {
            try {
                registry.register(descriptor);
                count++;
            } catch (ConfigException e) {
                log.warn("Skipping bootstrap executor. executorId={} reason={}",
                         descriptor == null ? null : descriptor.id(), e.getMessage());
            }
        }
        return count;
    }
}
