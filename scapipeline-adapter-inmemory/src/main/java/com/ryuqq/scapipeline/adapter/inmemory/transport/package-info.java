/**
 * In-memory {@code testing} transport.
 *
 * <p>All senders and receivers in one JVM share the queues of {@link com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryBroker},
 * keyed by queue name. Unacknowledged messages are redelivered after the visibility timeout.</p>
 *
 * <p><strong>Limitations:</strong> messages are lost on process restart. Use for tests and local runs only.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.adapter.inmemory.transport;
