package com.ryuqq.scapipeline.core.transport;

/**
 * Direction of a transport binding, part of the configuration variable names.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TransportDirection {
    SENDER,
    RECEIVER
}
