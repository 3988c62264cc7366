package com.modelrouter.router.transport;

import com.modelrouter.common.model.ModelInfo;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The two-method probe contract every executor exposes, whatever its transport.
 * The registry bounds both calls with its probe timeout.
 */
public interface ExecutorClient {

    /** Models the executor currently serves. Executor id and health are normalized by the registry. */
    Mono<List<ModelInfo>> listModels();

    /** True when the executor can accept work right now. */
    Mono<Boolean> healthCheck();
}
