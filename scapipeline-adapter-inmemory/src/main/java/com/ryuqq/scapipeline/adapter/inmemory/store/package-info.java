/**
 * In-memory repositories and secret store.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.adapter.inmemory.store;
