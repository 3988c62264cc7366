package com.modelrouter.router.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.scoring.AbilityCheckpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AbilityCheckpointHolderTest {

    private static AbilityCheckpointHolder holder(String location) {
        return new AbilityCheckpointHolder(new DefaultResourceLoader(), new ObjectMapper(), location);
    }

    @Test
    @DisplayName("classpath checkpoint loads at startup")
    void loadsAtStartup() {
        AbilityCheckpointHolder holder = holder("classpath:checkpoint-test.json");
        holder.init();

        AbilityCheckpoint checkpoint = holder.current();
        assertEquals("test-1", checkpoint.version());
        assertTrue(checkpoint.abilityOf("gpt-4").isPresent());
    }

    @Test
    @DisplayName("missing checkpoint at startup → empty checkpoint, no failure")
    void missingAtStartup() {
        AbilityCheckpointHolder holder = holder("classpath:nope.json");
        holder.init();

        assertEquals("empty", holder.current().version());
        assertTrue(holder.current().abilities().isEmpty());
    }

    @Test
    @DisplayName("malformed checkpoint at startup fails fast")
    void malformedAtStartup(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "{\"version\":\"bad\",\"dimensions\":[\"a\",\"b\"],\"weights\":[1.0]}");

        assertThrows(ConfigException.class, () -> holder(file.toUri().toString()).init());
    }

    @Test
    @DisplayName("failed reload keeps the current checkpoint")
    void failedReloadKeepsCurrent(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "{\"version\":\"v1\",\"dimensions\":[\"a\"],\"abilities\":{\"m1\":[0.5]}}");
        AbilityCheckpointHolder holder = holder(file.toUri().toString());
        holder.init();

        Files.writeString(file, "{\"version\":\"v2\",\"dimensions\":[\"a\"],\"abilities\":{\"m1\":[0.5, 0.1]}}");

        assertThrows(ConfigException.class, holder::reload);
        assertEquals("v1", holder.current().version());
    }

    @Test
    @DisplayName("successful reload swaps the checkpoint wholesale")
    void reloadSwaps(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "{\"version\":\"v1\",\"dimensions\":[\"a\"],\"abilities\":{\"m1\":[0.5]}}");
        AbilityCheckpointHolder holder = holder(file.toUri().toString());
        holder.init();

        Files.writeString(file, "{\"version\":\"v2\",\"dimensions\":[\"a\"],\"abilities\":{\"m2\":[0.7]}}");
        holder.reload();

        assertEquals("v2", holder.current().version());
        assertTrue(holder.current().abilityOf("m1").isEmpty());
    }
}
