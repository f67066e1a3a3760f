package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.ryuqq.scapipeline.core.transport.TransportException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A channel bound to one durable queue, with the connection that owns it.
 *
 * <p>Channels are not thread-safe. Callers synchronize on this object.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RabbitMqChannel implements AutoCloseable {

    private final Connection connection;
    private final Channel channel;
    private final String queueName;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param connection owning connection (null if the channel's lifecycle is managed elsewhere)
     * @param channel channel
     * @param queueName queue name
     */
    public RabbitMqChannel(Connection connection, Channel channel, String queueName) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName cannot be null or blank");
        }
        this.connection = connection;
        this.channel = channel;
        this.queueName = queueName;
    }

    public Channel channel() {
        return channel;
    }

    public String queueName() {
        return queueName;
    }

    /**
     * Declare the queue as durable, non-exclusive and not auto-deleted. Idempotent on the broker.
     *
     * @throws IOException if the declaration fails
     */
    public void declareQueue() throws IOException {
        synchronized (this) {
            channel.queueDeclare(queueName, true, false, false, null);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        TransportException failure = null;
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException | RuntimeException e) {
            failure = new TransportException("Cannot close RabbitMQ channel for queue '" + queueName + "'", e);
        } finally {
            failure = closeConnection(failure);
        }
        if (failure != null) {
            throw failure;
        }
    }

    private TransportException closeConnection(TransportException failure) {
        if (connection == null) {
            return failure;
        }
        try {
            if (connection.isOpen()) {
                connection.close();
            }
            return failure;
        } catch (IOException | RuntimeException e) {
            if (failure == null) {
                return new TransportException("Cannot close RabbitMQ connection for queue '" + queueName + "'", e);
            }
            failure.addSuppressed(e);
            return failure;
        }
    }
}
