package com.ryuqq.scapipeline.adapter.rabbitmq.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.ryuqq.scapipeline.core.transport.TransportConfig;
import com.ryuqq.scapipeline.core.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

/**
 * Opens broker connections from a {@link TransportConfig}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RabbitMqConnections {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqConnections.class);

    private RabbitMqConnections() {
    }

    /**
     * Connect and open a channel with the endpoint queue declared.
     *
     * @param config transport configuration
     * @return connection and channel
     * @throws TransportException if the broker cannot be reached
     */
    static RabbitMqChannel open(TransportConfig config) {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            if (config.serverUri() != null && !config.serverUri().isBlank()) {
                factory.setUri(config.serverUri());
            }
        } catch (URISyntaxException | GeneralSecurityException e) {
            throw new TransportException("Invalid RabbitMQ server URI: " + config.serverUri(), e);
        }
        if (config.username() != null) {
            factory.setUsername(config.username());
        }
        if (config.password() != null) {
            factory.setPassword(config.password());
        }

        Connection connection = null;
        try {
            connection = factory.newConnection("scapipeline-" + config.queueName());
            Channel channel = connection.createChannel();
            RabbitMqChannel opened = new RabbitMqChannel(connection, channel, config.queueName());
            opened.declareQueue();
            log.info("Connected to RabbitMQ queue '{}' at {}", config.queueName(), factory.getHost());
            return opened;
        } catch (IOException | TimeoutException e) {
            closeQuietly(connection, e);
            throw new TransportException("Cannot connect to RabbitMQ queue '" + config.queueName() + "'", e);
        }
    }

    private static void closeQuietly(Connection connection, Exception failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
