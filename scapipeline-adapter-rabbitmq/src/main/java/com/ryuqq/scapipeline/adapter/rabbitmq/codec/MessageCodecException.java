package com.ryuqq.scapipeline.adapter.rabbitmq.codec;

/**
 * Thrown when an envelope cannot be encoded or decoded.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MessageCodecException extends RuntimeException {

    public MessageCodecException(String message) {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
