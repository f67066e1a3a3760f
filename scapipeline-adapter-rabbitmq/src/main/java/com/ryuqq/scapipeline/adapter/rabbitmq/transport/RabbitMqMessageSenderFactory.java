package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.ryuqq.scapipeline.adapter.rabbitmq.codec.JsonMessageCodec;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.MessageSenderFactory;
import com.ryuqq.scapipeline.core.transport.TransportConfig;

/**
 * {@code rabbitMQ} transport senders. Each sender owns one connection.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RabbitMqMessageSenderFactory implements MessageSenderFactory {

    public static final String TRANSPORT_NAME = "rabbitMQ";

    @Override
    public String name() {
        return TRANSPORT_NAME;
    }

    @Override
    public <T extends MessagePayload> MessageSender<T> createSender(Endpoint<T> endpoint, TransportConfig config) {
        return new RabbitMqMessageSender<>(RabbitMqConnections.open(config), new JsonMessageCodec());
    }
}
