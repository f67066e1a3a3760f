package com.ryuqq.scapipeline.core.transport;

import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.MessagePayload;

/**
 * A message delivered to a consumer and not yet acknowledged.
 *
 * @param deliveryId transport-specific delivery handle used for ack/nack
 * @param envelope the delivered envelope
 * @param redelivered whether the transport flagged this as a repeated delivery
 * @param <T> payload type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReceivedMessage<T extends MessagePayload>(
    String deliveryId,
    Envelope<T> envelope,
    boolean redelivered
) {

    public ReceivedMessage {
        if (deliveryId == null || deliveryId.isBlank()) {
            throw new IllegalArgumentException("deliveryId cannot be null or blank");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
    }
}
