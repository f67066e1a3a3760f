package com.ryuqq.scapipeline.adapter.inmemory.transport;

import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.MessageReceiverFactory;
import com.ryuqq.scapipeline.core.transport.TransportConfig;

/**
 * {@code testing} transport receivers backed by the {@link InMemoryBroker}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryMessageReceiverFactory implements MessageReceiverFactory {

    @Override
    public String name() {
        return InMemoryMessageSenderFactory.TRANSPORT_NAME;
    }

    @Override
    public <T extends MessagePayload> MessageReceiver<T> createReceiver(Endpoint<T> endpoint, TransportConfig config) {
        return new InMemoryMessageReceiver<>(InMemoryBroker.getInstance().queue(config.queueName()), endpoint.payloadType());
    }
}
