package com.ryuqq.scapipeline.core.transport;

import java.util.Map;

/**
 * Transport configuration for one endpoint and direction.
 *
 * <p>Read from environment variables named {@code {PREFIX}_{SENDER|RECEIVER}_{KEY}}, for example:</p>
 * <pre>
 * SCANNER_RECEIVER_TRANSPORT_TYPE=rabbitMQ
 * SCANNER_RECEIVER_TRANSPORT_SERVER_URI=amqp://broker:5672
 * SCANNER_RECEIVER_TRANSPORT_QUEUE_NAME=scanner
 * SCANNER_RECEIVER_TRANSPORT_USERNAME=ort
 * SCANNER_RECEIVER_TRANSPORT_PASSWORD=secret
 * </pre>
 *
 * <p>Only the type is mandatory. The queue name defaults to the endpoint name.</p>
 *
 * @param type transport type identifier
 * @param serverUri broker URI (nullable)
 * @param queueName queue or destination name
 * @param username broker user (nullable)
 * @param password broker password (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransportConfig(
    String type,
    String serverUri,
    String queueName,
    String username,
    String password
) {

    public static final String TYPE = "TRANSPORT_TYPE";
    public static final String SERVER_URI = "TRANSPORT_SERVER_URI";
    public static final String QUEUE_NAME = "TRANSPORT_QUEUE_NAME";
    public static final String USERNAME = "TRANSPORT_USERNAME";
    public static final String PASSWORD = "TRANSPORT_PASSWORD";

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if type or queueName is null or blank
     */
    public TransportConfig {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName cannot be null or blank");
        }
    }

    /**
     * Creates a configuration with only a type and queue name.
     *
     * @param type transport type identifier
     * @param queueName queue name
     * @return the configuration
     */
    public static TransportConfig of(String type, String queueName) {
        return new TransportConfig(type, null, queueName, null, null);
    }

    /**
     * Reads the configuration for an endpoint from environment variables.
     *
     * @param endpoint the endpoint
     * @param direction sender or receiver side
     * @param environment variable map (usually {@link System#getenv()})
     * @return the configuration
     * @throws IllegalArgumentException if the transport type variable is missing
     */
    public static TransportConfig fromEnvironment(
        Endpoint<?> endpoint,
        TransportDirection direction,
        Map<String, String> environment
    ) {
        String prefix = endpoint.configPrefix() + "_" + direction.name() + "_";
        String type = environment.get(prefix + TYPE);
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Missing transport configuration: " + prefix + TYPE);
        }
        String queueName = environment.get(prefix + QUEUE_NAME);
        return new TransportConfig(
            type,
            environment.get(prefix + SERVER_URI),
            queueName == null || queueName.isBlank() ? endpoint.name() : queueName,
            environment.get(prefix + USERNAME),
            environment.get(prefix + PASSWORD)
        );
    }

    @Override
    public String toString() {
        return "TransportConfig[type=" + type + ", serverUri=" + serverUri + ", queueName=" + queueName
            + ", username=" + username + ", password=" + (password == null ? "null" : "***") + "]";
    }
}
