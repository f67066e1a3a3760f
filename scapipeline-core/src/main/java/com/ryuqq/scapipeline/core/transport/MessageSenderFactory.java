package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.MessagePayload;

/**
 * Creates {@link MessageSender}s for one transport technology.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and selected by
 * {@link #name()} matching the configured transport type.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageSenderFactory {

    /**
     * Transport type identifier (e.g. {@code testing}, {@code rabbitMQ}).
     *
     * @return the type identifier
     */
    String name();

    /**
     * Creates a sender bound to the given endpoint.
     *
     * @param endpoint the target endpoint
     * @param config transport configuration for the endpoint
     * @param <T> payload type
     * @return a new sender
     * @throws TransportException if the transport cannot be reached
     */
    <T extends MessagePayload> MessageSender<T> createSender(Endpoint<T> endpoint, TransportConfig config);
}
