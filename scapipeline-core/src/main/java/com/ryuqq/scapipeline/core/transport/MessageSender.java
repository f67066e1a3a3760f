package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;

/**
 * Sends envelopes to one endpoint.
 *
 * <p>Implementations are bound to a single endpoint at creation time by a {@link MessageSenderFactory}.
 * They must be safe for use by multiple threads.</p>
 *
 * @param <T> payload type of the target endpoint
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageSender<T extends MessagePayload> extends AutoCloseable {

    /**
     * Enqueues an envelope to the bound endpoint.
     *
     * <p>Returns once the transport has accepted the message. Delivery is at-least-once.</p>
     *
     * @param envelope the envelope to send
     * @throws IllegalArgumentException if envelope is null
     * @throws TransportException if the transport rejected or failed to accept the message
     */
    void send(Envelope<T> envelope);

    /**
     * Releases transport resources held by this sender. Idempotent.
     */
    @Override
    default void close() {
    }
}
