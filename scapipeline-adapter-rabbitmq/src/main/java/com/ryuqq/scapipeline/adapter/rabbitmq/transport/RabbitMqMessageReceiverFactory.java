package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.ryuqq.scapipeline.adapter.rabbitmq.codec.JsonMessageCodec;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.MessageReceiverFactory;
import com.ryuqq.scapipeline.core.transport.TransportConfig;

/**
 * {@code rabbitMQ} transport receivers. Each receiver owns one connection.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RabbitMqMessageReceiverFactory implements MessageReceiverFactory {

    @Override
    public String name() {
        return RabbitMqMessageSenderFactory.TRANSPORT_NAME;
    }

    @Override
    public <T extends MessagePayload> MessageReceiver<T> createReceiver(Endpoint<T> endpoint, TransportConfig config) {
        return new RabbitMqMessageReceiver<>(RabbitMqConnections.open(config), new JsonMessageCodec(), endpoint.payloadType());
    }
}
