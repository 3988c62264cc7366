package com.modelrouter.router.transport;

import com.modelrouter.common.model.ExecutorDescriptor;
import com.modelrouter.common.model.TransportKind;

/**
 * Factory for {@link ExecutorClient}s of one transport kind. Register one Spring bean per
 * transport; {@link TransportRegistry} picks the right one for each descriptor.
 */
public interface ExecutorTransport {

    TransportKind kind();

    /**
     * Build a client for the descriptor.
     *
     * @throws com.modelrouter.common.exception.ConfigException when the descriptor lacks a
     *         field this transport needs
     */
    ExecutorClient connect(ExecutorDescriptor descriptor);
}
