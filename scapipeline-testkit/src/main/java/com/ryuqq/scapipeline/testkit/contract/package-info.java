/**
 * End-to-end contract fixtures running the whole pipeline on the in-memory adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.testkit.contract;
