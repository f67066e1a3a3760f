package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.MessagePayload;

import java.util.Optional;

/**
 * Receives envelopes from one endpoint with competing-consumer semantics.
 *
 * <p>Each message is delivered to exactly one consumer among all receivers bound to the same endpoint.
 * A delivered message stays invisible to other consumers until it is acknowledged, negatively acknowledged,
 * or the transport's visibility timeout expires, after which it is redelivered.</p>
 *
 * <p><strong>Processing contract:</strong></p>
 * <pre>
 * Optional&lt;ReceivedMessage&lt;T&gt;&gt; message = receiver.receive(1000);
 * message.ifPresent(m -&gt; {
 *     try {
 *         process(m.envelope());
 *         receiver.ack(m);
 *     } catch (Exception e) {
 *         receiver.nack(m);
 *     }
 * });
 * </pre>
 *
 * @param <T> payload type of the bound endpoint
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageReceiver<T extends MessagePayload> extends AutoCloseable {

    /**
     * Waits for the next message.
     *
     * @param timeoutMs maximum time to wait in milliseconds (0 means do not wait)
     * @return the next message, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     * @throws TransportException if the transport failed
     */
    Optional<ReceivedMessage<T>> receive(long timeoutMs) throws InterruptedException;

    /**
     * Permanently removes a delivered message. Idempotent.
     *
     * @param message the delivered message
     * @throws TransportException if the transport failed
     */
    void ack(ReceivedMessage<T> message);

    /**
     * Returns a delivered message to the endpoint for redelivery.
     *
     * @param message the delivered message
     * @throws TransportException if the transport failed
     */
    void nack(ReceivedMessage<T> message);

    /**
     * Releases transport resources held by this receiver. Idempotent.
     */
    @Override
    default void close() {
    }
}
