/**
 * Message transport SPI.
 *
 * <p>Defines typed send/receive primitives addressed by logical {@link com.ryuqq.scapipeline.core.transport.Endpoint}s.
 * Adapter modules provide implementations and register their factories through
 * {@code META-INF/services}.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scapipeline.core.transport.MessageSender} / {@link com.ryuqq.scapipeline.core.transport.MessageSenderFactory}</li>
 *   <li>{@link com.ryuqq.scapipeline.core.transport.MessageReceiver} / {@link com.ryuqq.scapipeline.core.transport.MessageReceiverFactory}</li>
 * </ul>
 *
 * <h2>Delivery Semantics</h2>
 * <ul>
 *   <li><strong>Competing consumers:</strong> each message reaches one receiver per endpoint</li>
 *   <li><strong>At-least-once:</strong> unacknowledged messages are redelivered</li>
 *   <li><strong>No cross-endpoint ordering</strong></li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scapipeline.core.transport;
