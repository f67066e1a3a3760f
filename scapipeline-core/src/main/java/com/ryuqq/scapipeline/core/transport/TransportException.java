package com.ryuqq.scapipeline.core.transport;

/**
 * Thrown when a transport fails to send, receive or acknowledge a message.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
