/**
 * Directory-backed configuration manager.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.adapter.inmemory.config;
