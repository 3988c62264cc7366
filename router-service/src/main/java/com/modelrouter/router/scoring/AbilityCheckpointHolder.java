package com.modelrouter.router.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.scoring.AbilityCheckpoint;
import com.modelrouter.common.scoring.FeatureDifficultyMapping;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link AbilityCheckpoint} and swaps it wholesale on reload.
 *
 * <p>Startup: a missing checkpoint resource leaves an empty checkpoint in place (every
 * candidate is scored with the missing-ability penalty) and logs a WARN; a malformed one
 * fails fast. Reload: any failure keeps the current checkpoint and surfaces a
 * {@link ConfigException} to the operator.
 */
@Component
public class AbilityCheckpointHolder {

    private static final Logger log = LoggerFactory.getLogger(AbilityCheckpointHolder.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;
    private final AtomicReference<AbilityCheckpoint> current =
        new AtomicReference<>(AbilityCheckpoint.empty(FeatureDifficultyMapping.DEFAULT_DIMENSIONS));

    public AbilityCheckpointHolder(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                   @Value("${router.scoring.checkpoint:}") String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
        this.location       = location;
    }

    @PostConstruct
    public void init() {
        if (location == null || location.isBlank() || !resourceLoader.getResource(location).exists()) {
            log.warn("CHECKPOINT_MISSING location={} - scoring with empty checkpoint", location);
            return;
        }
        AbilityCheckpoint loaded = load(location);
        current.set(loaded);
        log.info("CHECKPOINT_LOADED version={} dimensions={} models={}",
                 loaded.version(), loaded.dimensions().size(), loaded.abilities().size());
    }

    public AbilityCheckpoint current() {
        return current.get();
    }

    /** Re-reads the configured location and swaps it in. The previous checkpoint survives a failure. */
    public AbilityCheckpoint reload() {
        AbilityCheckpoint previous = current.get();
        AbilityCheckpoint loaded;
        try {
            loaded = load(location);
        } catch (ConfigException e) {
            log.warn("CHECKPOINT_RELOAD_FAILED keptVersion={} reason={}", previous.version(), e.getMessage());
            throw e;
        }
        current.set(loaded);
        log.info("CHECKPOINT_RELOADED previousVersion={} version={} models={}",
                 previous.version(), loaded.version(), loaded.abilities().size());
        return loaded;
    }

    private AbilityCheckpoint load(String resourceLocation) {
        if (resourceLocation == null || resourceLocation.isBlank()) {
            throw new ConfigException("No ability checkpoint location configured");
        }
        Resource resource = resourceLoader.getResource(resourceLocation);
        if (!resource.exists()) {
            throw new ConfigException("Ability checkpoint not found at " + resourceLocation);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, AbilityCheckpoint.class);
        } catch (IOException e) {
            throw new ConfigException("Malformed ability checkpoint at " + resourceLocation, e);
        }
    }
}
