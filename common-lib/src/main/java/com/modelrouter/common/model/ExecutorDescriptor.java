package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Operator-supplied registration for one executor.
 *
 * <ul>
 *   <li>{@code transport}     : "http", "cli" or "rpc" (parsed by {@link TransportKind#parse})</li>
 *   <li>{@code endpoint}      : base URL, required for HTTP</li>
 *   <li>{@code command}       : model-list command line, required for CLI (e.g. {@code ollama list})</li>
 *   <li>{@code capabilities}  : declared capability tags, copied onto every discovered model</li>
 *   <li>{@code fallbackModels}: static model list used when a healthy probe reports no models</li>
 * </ul>
 */
public record ExecutorDescriptor(
    @JsonProperty("id") String id,
    @JsonProperty("transport") String transport,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("command") List<String> command,
    @JsonProperty("capabilities") List<String> capabilities,
    @JsonProperty("fallbackModels") List<ModelInfo> fallbackModels
) {
    public ExecutorDescriptor {
        command        = command == null ? List.of() : List.copyOf(command);
        capabilities   = capabilities == null ? List.of() : List.copyOf(capabilities);
        fallbackModels = fallbackModels == null ? List.of() : List.copyOf(fallbackModels);
    }

    public static ExecutorDescriptor http(String id, String endpoint) {
        return new ExecutorDescriptor(id, "http", endpoint, List.of(), List.of(), List.of());
    }

    public static ExecutorDescriptor cli(String id, List<String> command) {
        return new ExecutorDescriptor(id, "cli", null, command, List.of(), List.of());
    }
}
