/**
 * Worker Context.
 *
 * <p>단계 1회 실행 동안 Run에 바인딩된 secret/설정 파일 해석과 임시 디렉터리를 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.worker.context;
