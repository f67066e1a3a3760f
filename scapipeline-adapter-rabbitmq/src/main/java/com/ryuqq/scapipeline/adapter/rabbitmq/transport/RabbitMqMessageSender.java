package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.rabbitmq.client.AMQP;
import com.ryuqq.scapipeline.adapter.rabbitmq.codec.JsonMessageCodec;
import com.ryuqq.scapipeline.adapter.rabbitmq.codec.MessageCodecException;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Publishes envelopes to a durable queue through the default exchange.
 *
 * <p>Messages are persistent ({@code deliveryMode=2}) and carry the trace ID as correlation ID.</p>
 *
 * @param <T> payload type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RabbitMqMessageSender<T extends MessagePayload> implements MessageSender<T> {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqMessageSender.class);

    static final String CONTENT_TYPE = "application/json";
    static final int PERSISTENT = 2;

    private final RabbitMqChannel channel;
    private final JsonMessageCodec codec;

    public RabbitMqMessageSender(RabbitMqChannel channel, JsonMessageCodec codec) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.channel = channel;
        this.codec = codec;
    }

    @Override
    public void send(Envelope<T> envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }

        byte[] body;
        try {
            body = codec.encode(envelope);
        } catch (MessageCodecException e) {
            throw new TransportException(e.getMessage(), e);
        }

        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .contentType(CONTENT_TYPE)
            .deliveryMode(PERSISTENT)
            .correlationId(envelope.header().traceId())
            .build();
        try {
            synchronized (channel) {
                channel.channel().basicPublish("", channel.queueName(), properties, body);
            }
        } catch (IOException e) {
            throw new TransportException("Cannot publish to queue '" + channel.queueName() + "'", e);
        }
        log.debug("Published {} to {} (traceId={})",
            envelope.payload().getClass().getSimpleName(), channel.queueName(), envelope.header().traceId());
    }

    @Override
    public void close() {
        channel.close();
    }
}
