package com.modelrouter.router.transport;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.common.model.ExecutorDescriptor;
import com.modelrouter.common.model.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Looks up the {@link ExecutorTransport} bean serving a descriptor's transport kind. */
@Component
public class TransportRegistry {

    private static final Logger log = LoggerFactory.getLogger(TransportRegistry.class);

    private final Map<TransportKind, ExecutorTransport> transports = new EnumMap<>(TransportKind.class);

    public TransportRegistry(List<ExecutorTransport> transports) {
        for (ExecutorTransport t : transports) {
            this.transports.put(t.kind(), t);
        }
        log.info("Executor transports available. kinds={}", this.transports.keySet());
    }

    public ExecutorClient connect(TransportKind kind, ExecutorDescriptor descriptor) {
        ExecutorTransport transport = transports.get(kind);
        if (transport == null) {
            throw new ConfigException("No adapter for transport " + kind + " (executor " + descriptor.id() + ")");
        }
        return transport.connect(descriptor);
    }
}
