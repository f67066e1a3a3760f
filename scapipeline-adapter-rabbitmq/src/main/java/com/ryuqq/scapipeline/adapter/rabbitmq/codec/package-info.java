/**
 * JSON envelope codec.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.adapter.rabbitmq.codec;
