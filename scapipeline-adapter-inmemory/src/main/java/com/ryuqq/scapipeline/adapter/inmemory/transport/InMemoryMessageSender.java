package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.MessageSender;

/**
 * Sends to an {@link InMemoryQueue}.
 *
 * @param <T> payload type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryMessageSender<T extends MessagePayload> implements MessageSender<T> {

    private final InMemoryQueue queue;

    public InMemoryMessageSender(InMemoryQueue queue) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        this.queue = queue;
    }

    @Override
    public void send(Envelope<T> envelope) {
        queue.send(envelope);
    }
}
