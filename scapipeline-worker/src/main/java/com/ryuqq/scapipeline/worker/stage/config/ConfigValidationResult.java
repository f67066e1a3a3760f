package com.ryuqq.scapipeline.worker.stage.config;

import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;

import java.util.List;

/**
 * Job configuration 검증 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ConfigValidationResult {

    List<Issue> issues();

    /**
     * 검증 성공.
     *
     * @param resolvedJobConfigs 이후 단계가 사용할 job configuration
     * @param issues 치명적이지 않은 Issue
     */
    record Success(JobConfigurations resolvedJobConfigs, List<Issue> issues) implements ConfigValidationResult {

        public Success {
            if (resolvedJobConfigs == null) {
                throw new IllegalArgumentException("resolvedJobConfigs cannot be null");
            }
            issues = issues == null ? List.of() : List.copyOf(issues);
        }
    }

    /**
     * 검증 실패. Run은 FAILED가 됩니다.
     *
     * @param issues 실패 원인
     */
    record Failure(List<Issue> issues) implements ConfigValidationResult {

        public Failure {
            if (issues == null || issues.isEmpty()) {
                throw new IllegalArgumentException("issues cannot be null or empty");
            }
            issues = List.copyOf(issues);
        }
    }
}
