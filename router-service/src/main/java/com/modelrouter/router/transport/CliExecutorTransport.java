package com.modelrouter.router.transport;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.ExecutorDescriptor;
import com.modelrouter.common.model.ModelInfo;
import com.modelrouter.common.model.TransportKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Subprocess executor adapter for local runtimes that list their models on the command line
 * ({@code ollama list} style: one model per line, id in the first column, optional header row).
 *
 * <p>Health is the list command's exit status. Commands run on Reactor's bounded-elastic
 * scheduler so the probe loop never blocks an event-loop thread.
 */
@Component
public class CliExecutorTransport implements ExecutorTransport {

    private final CommandRunner commandRunner;
    private final Duration commandTimeout;

    public CliExecutorTransport(CommandRunner commandRunner,
                                @Value("${router.registry.probe-timeout:2s}") Duration commandTimeout) {
        this.commandRunner  = commandRunner;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.CLI;
    }

    @Override
    public ExecutorClient connect(ExecutorDescriptor descriptor) {
        if (descriptor.command().isEmpty()) {
            throw new ConfigException("CLI executor " + descriptor.id() + " has no command");
        }
        return new CliExecutorClient(descriptor);
    }

    private class CliExecutorClient implements ExecutorClient {

        private final ExecutorDescriptor descriptor;

        CliExecutorClient(ExecutorDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public Mono<List<ModelInfo>> listModels() {
            return run().map(result -> {
                if (!result.succeeded()) {
                    throw new IllegalStateException("Model list command exited with " + result.exitCode());
                }
                return parseListing(descriptor.id(), result.stdout());
            });
        }

        @Override
        public Mono<Boolean> healthCheck() {
            return run().map(CommandRunner.Result::succeeded);
        }

        private Mono<CommandRunner.Result> run() {
            return Mono.fromCallable(() -> {
                    try {
                        return commandRunner.run(descriptor.command(), commandTimeout);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException("Interrupted running " + descriptor.command(), e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
        }
    }

    static List<ModelInfo> parseListing(String executorId, String stdout) {
        List<ModelInfo> models = new ArrayList<>();
        for (String line : stdout.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            String first = trimmed.split("\\s+")[0];
            if ("NAME".equals(first.toUpperCase(Locale.ROOT))) continue;
            models.add(new ModelInfo(first, executorId, first, 0.0, 0, List.of(), true));
        }
        return models;
    }
}
