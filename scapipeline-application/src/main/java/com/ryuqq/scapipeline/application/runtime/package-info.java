/**
 * Runtime contract for endpoint message processing.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scapipeline.application.runtime;
