/**
 * 저장소 environment configuration 해석과 단계 프로세스 환경 준비.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.worker.environment;
