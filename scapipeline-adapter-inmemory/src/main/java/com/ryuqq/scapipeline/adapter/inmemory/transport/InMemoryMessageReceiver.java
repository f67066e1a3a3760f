package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.ReceivedMessage;
import com.ryuqq.scapipeline.core.transport.TransportException;

import java.util.Optional;

/**
 * Receives from an {@link InMemoryQueue}.
 *
 * <p>A message whose payload does not match the endpoint's payload type is acknowledged and
 * reported as a {@link TransportException}.</p>
 *
 * @param <T> payload type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryMessageReceiver<T extends MessagePayload> implements MessageReceiver<T> {

    private final InMemoryQueue queue;
    private final Class<T> payloadType;

    public InMemoryMessageReceiver(InMemoryQueue queue, Class<T> payloadType) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (payloadType == null) {
            throw new IllegalArgumentException("payloadType cannot be null");
        }
        this.queue = queue;
        this.payloadType = payloadType;
    }

    @Override
    public Optional<ReceivedMessage<T>> receive(long timeoutMs) throws InterruptedException {
        Optional<InMemoryQueue.Delivery> delivery = queue.receive(timeoutMs);
        if (delivery.isEmpty()) {
            return Optional.empty();
        }

        InMemoryQueue.Delivery received = delivery.get();
        Envelope<? extends MessagePayload> envelope = received.envelope();
        if (!payloadType.isInstance(envelope.payload())) {
            queue.ack(received.deliveryId());
            throw new TransportException(
                "Unexpected payload " + envelope.payload().getClass().getName()
                    + " on queue '" + queue.name() + "', expected " + payloadType.getName()
            );
        }

        Envelope<T> typed = Envelope.of(envelope.header(), payloadType.cast(envelope.payload()));
        return Optional.of(new ReceivedMessage<>(received.deliveryId(), typed, received.redelivered()));
    }

    @Override
    public void ack(ReceivedMessage<T> message) {
        queue.ack(message.deliveryId());
    }

    @Override
    public void nack(ReceivedMessage<T> message) {
        queue.nack(message.deliveryId());
    }
}
