/**
 * Package manager specific environment definitions and the factory creating them.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scapipeline.worker.environment.definition;
