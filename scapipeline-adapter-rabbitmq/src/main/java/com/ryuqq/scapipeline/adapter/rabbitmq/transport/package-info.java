/**
 * RabbitMQ {@code rabbitMQ} transport.
 *
 * <p>One durable queue per endpoint, published through the default exchange. Receivers poll with
 * {@code basicGet} and acknowledge manually, so an unacknowledged message returns to the queue when
 * the consumer's connection closes.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.adapter.rabbitmq.transport;
