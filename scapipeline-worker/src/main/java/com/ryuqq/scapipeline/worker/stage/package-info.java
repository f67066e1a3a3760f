/**
 * Stage handler contract.
 *
 * <p>Concrete handlers live in the sub-packages, one per stage.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scapipeline.worker.stage;
