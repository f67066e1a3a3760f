package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.MessageSenderFactory;
import com.ryuqq.scapipeline.core.transport.TransportConfig;

/**
 * {@code testing} transport senders backed by the {@link InMemoryBroker}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryMessageSenderFactory implements MessageSenderFactory {

    public static final String TRANSPORT_NAME = "testing";

    @Override
    public String name() {
        return TRANSPORT_NAME;
    }

    @Override
    public <T extends MessagePayload> MessageSender<T> createSender(Endpoint<T> endpoint, TransportConfig config) {
        return new InMemoryMessageSender<>(InMemoryBroker.getInstance().queue(config.queueName()));
    }
}
