package com.modelrouter.router.controller;

import com.modelrouter.common.model.Executor;
import com.modelrouter.common.model.ExecutorDescriptor;
import com.modelrouter.router.registry.ExecutorRegistry;
import com.modelrouter.router.registry.RegistrySnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/executors")
public class ExecutorController {

    private final ExecutorRegistry executorRegistry;

    public ExecutorController(ExecutorRegistry executorRegistry) {
        this.executorRegistry = executorRegistry;
    }

    /** Registers the executor and probes it once right away so its models show up without waiting a cycle. */
    @PostMapping
    public Mono<Executor> register(@RequestBody ExecutorDescriptor descriptor) {
        Executor registered = executorRegistry.register(descriptor);
        return executorRegistry.probe(registered.id()).defaultIfEmpty(registered);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deregister(@PathVariable String id) {
        return executorRegistry.deregister(id)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping
    public List<Executor> executors() {
        return executorRegistry.executors();
    }

    @GetMapping("/snapshot")
    public RegistrySnapshot snapshot() {
        return executorRegistry.snapshot();
    }
}
