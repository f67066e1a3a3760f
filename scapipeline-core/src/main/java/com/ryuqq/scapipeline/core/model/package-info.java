/**
 * 도메인 모델.
 *
 * <p>Run, Hierarchy, Secret, InfrastructureService, Issue와 job configuration 타입을 정의합니다.
 * 모든 타입은 불변 record 또는 enum입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.core.model;
