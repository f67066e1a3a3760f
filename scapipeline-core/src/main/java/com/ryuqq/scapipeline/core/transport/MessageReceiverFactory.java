package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.MessagePayload;

/**
 * Creates {@link MessageReceiver}s for one transport technology.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see MessageSenderFactory
 */
public interface MessageReceiverFactory {

    /**
     * Transport type identifier (e.g. {@code testing}, {@code rabbitMQ}).
     *
     * @return the type identifier
     */
    String name();

    /**
     * Creates a receiver bound to the given endpoint.
     *
     * @param endpoint the source endpoint
     * @param config transport configuration for the endpoint
     * @param <T> payload type
     * @return a new receiver
     * @throws TransportException if the transport cannot be reached
     */
    <T extends MessagePayload> MessageReceiver<T> createReceiver(Endpoint<T> endpoint, TransportConfig config);
}
