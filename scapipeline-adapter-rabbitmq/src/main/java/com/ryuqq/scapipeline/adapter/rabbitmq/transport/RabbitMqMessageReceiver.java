package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.rabbitmq.client.GetResponse;
import com.ryuqq.scapipeline.adapter.rabbitmq.codec.JsonMessageCodec;
import com.ryuqq.scapipeline.adapter.rabbitmq.codec.MessageCodecException;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.ReceivedMessage;
import com.ryuqq.scapipeline.core.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Polls a durable queue with {@code basicGet} and manual acknowledgement.
 *
 * <p>The delivery tag is the delivery ID. A message that cannot be decoded, or whose payload does not
 * match the endpoint, is rejected without requeue and reported as a {@link TransportException}.</p>
 *
 * @param <T> payload type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RabbitMqMessageReceiver<T extends MessagePayload> implements MessageReceiver<T> {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqMessageReceiver.class);

    static final long POLL_INTERVAL_MS = 100L;

    private final RabbitMqChannel channel;
    private final JsonMessageCodec codec;
    private final Class<T> payloadType;

    public RabbitMqMessageReceiver(RabbitMqChannel channel, JsonMessageCodec codec, Class<T> payloadType) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (payloadType == null) {
            throw new IllegalArgumentException("payloadType cannot be null");
        }
        this.channel = channel;
        this.codec = codec;
        this.payloadType = payloadType;
    }

    @Override
    public Optional<ReceivedMessage<T>> receive(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + Math.max(0, timeoutMs);
        while (true) {
            GetResponse response = poll();
            if (response != null) {
                return Optional.of(toMessage(response));
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.min(POLL_INTERVAL_MS, remaining));
        }
    }

    @Override
    public void ack(ReceivedMessage<T> message) {
        long tag = deliveryTag(message);
        try {
            synchronized (channel) {
                channel.channel().basicAck(tag, false);
            }
        } catch (IOException e) {
            throw new TransportException("Cannot ack delivery " + tag + " on queue '" + channel.queueName() + "'", e);
        }
    }

    @Override
    public void nack(ReceivedMessage<T> message) {
        long tag = deliveryTag(message);
        try {
            synchronized (channel) {
                channel.channel().basicNack(tag, false, true);
            }
        } catch (IOException e) {
            throw new TransportException("Cannot nack delivery " + tag + " on queue '" + channel.queueName() + "'", e);
        }
    }

    @Override
    public void close() {
        channel.close();
    }

    private GetResponse poll() {
        try {
            synchronized (channel) {
                return channel.channel().basicGet(channel.queueName(), false);
            }
        } catch (IOException e) {
            throw new TransportException("Cannot receive from queue '" + channel.queueName() + "'", e);
        }
    }

    private ReceivedMessage<T> toMessage(GetResponse response) {
        long tag = response.getEnvelope().getDeliveryTag();
        Envelope<MessagePayload> envelope;
        try {
            envelope = codec.decode(response.getBody());
        } catch (MessageCodecException e) {
            reject(tag);
            throw new TransportException("Rejected malformed message on queue '" + channel.queueName() + "'", e);
        }

        if (!payloadType.isInstance(envelope.payload())) {
            reject(tag);
            throw new TransportException(
                "Unexpected payload " + envelope.payload().getClass().getSimpleName()
                    + " on queue '" + channel.queueName() + "', expected " + payloadType.getSimpleName()
            );
        }

        Envelope<T> typed = Envelope.of(envelope.header(), payloadType.cast(envelope.payload()));
        return new ReceivedMessage<>(String.valueOf(tag), typed, response.getEnvelope().isRedeliver());
    }

    private void reject(long tag) {
        try {
            synchronized (channel) {
                channel.channel().basicReject(tag, false);
            }
        } catch (IOException e) {
            log.error("Cannot reject delivery {} on queue '{}'", tag, channel.queueName(), e);
        }
    }

    private static long deliveryTag(ReceivedMessage<?> message) {
        try {
            return Long.parseLong(message.deliveryId());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a RabbitMQ delivery: " + message.deliveryId(), e);
        }
    }
}
