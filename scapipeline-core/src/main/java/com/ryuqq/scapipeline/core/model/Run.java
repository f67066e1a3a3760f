package com.ryuqq.scapipeline.core.model;

import com.ryuqq.scapipeline.core.statemachine.RunStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 1회 실행.
 *
 * <p>Run은 불변 record이며, Orchestrator는 {@code withX} 메서드로 새 인스턴스를 만들어 저장합니다.
 * 같은 Run의 상태 전이는 Orchestrator가 run ID 단위로 직렬화합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>status / currentStage:</strong> 상태 머신 위치. currentStage는 결과를 기다리는 단계</li>
 *   <li><strong>jobConfigs / resolvedJobConfigs:</strong> 선언된 설정과 CONFIG 단계가 해석한 설정</li>
 *   <li><strong>jobConfigContext / resolvedJobConfigContext:</strong> 설정 저장소 branch/tag 선택자</li>
 *   <li><strong>issues:</strong> 누적된 Issue (추가만 가능)</li>
 *   <li><strong>traceId:</strong> 프로세스 간 상관 관계 ID, 모든 요청/결과 header에 전파</li>
 * </ul>
 *
 * @param id Run ID
 * @param organizationId 조직 ID
 * @param productId 제품 ID
 * @param repositoryId 저장소 ID
 * @param revision 분석할 revision
 * @param status 현재 상태
 * @param jobConfigs 선언된 job configuration
 * @param resolvedJobConfigs 해석된 job configuration (CONFIG 완료 전에는 null)
 * @param labels 자유 형식 label
 * @param issues 누적 Issue
 * @param jobConfigContext 설정 context (null 가능)
 * @param resolvedJobConfigContext 해석된 설정 context (null 가능)
 * @param traceId trace ID
 * @param currentStage 결과를 기다리는 단계 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Run(
    long id,
    long organizationId,
    long productId,
    long repositoryId,
    String revision,
    RunStatus status,
    JobConfigurations jobConfigs,
    JobConfigurations resolvedJobConfigs,
    Map<String, String> labels,
    List<Issue> issues,
    String jobConfigContext,
    String resolvedJobConfigContext,
    String traceId,
    PipelineStage currentStage
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public Run {
        if (revision == null || revision.isBlank()) {
            throw new IllegalArgumentException("revision cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (jobConfigs == null) {
            throw new IllegalArgumentException("jobConfigs cannot be null");
        }
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId cannot be null or blank");
        }
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * CREATED 상태의 새 Run 생성.
     *
     * @param id Run ID
     * @param hierarchy 저장소 hierarchy
     * @param revision revision
     * @param jobConfigs 요청된 job configuration
     * @param jobConfigContext 설정 context (null 가능)
     * @param traceId trace ID
     * @return 새 Run
     */
    public static Run create(
        long id,
        Hierarchy hierarchy,
        String revision,
        JobConfigurations jobConfigs,
        String jobConfigContext,
        String traceId
    ) {
        return new Run(
            id,
            hierarchy.organization().id(),
            hierarchy.product().id(),
            hierarchy.repository().id(),
            revision,
            RunStatus.CREATED,
            jobConfigs,
            null,
            Map.of(),
            List.of(),
            jobConfigContext,
            null,
            traceId,
            null
        );
    }

    /**
     * 실행 결정에 사용할 job configuration.
     *
     * @return 해석된 설정이 있으면 그것을, 없으면 선언된 설정
     */
    public JobConfigurations effectiveJobConfigs() {
        return resolvedJobConfigs != null ? resolvedJobConfigs : jobConfigs;
    }

    public Run withStatus(RunStatus newStatus) {
        return new Run(id, organizationId, productId, repositoryId, revision, newStatus, jobConfigs,
            resolvedJobConfigs, labels, issues, jobConfigContext, resolvedJobConfigContext, traceId, currentStage);
    }

    public Run withCurrentStage(PipelineStage stage) {
        return new Run(id, organizationId, productId, repositoryId, revision, status, jobConfigs,
            resolvedJobConfigs, labels, issues, jobConfigContext, resolvedJobConfigContext, traceId, stage);
    }

    /**
     * CONFIG 단계의 해석 결과를 반영한 새 인스턴스.
     *
     * @param configs 해석된 job configuration
     * @param context 해석된 설정 context
     * @return 새 Run
     */
    public Run withResolvedJobConfigs(JobConfigurations configs, String context) {
        return new Run(id, organizationId, productId, repositoryId, revision, status, jobConfigs,
            configs, labels, issues, jobConfigContext, context, traceId, currentStage);
    }

    /**
     * Issue를 뒤에 추가한 새 인스턴스.
     *
     * @param newIssues 추가할 Issue
     * @return 새 Run (추가할 것이 없으면 this)
     */
    public Run appendIssues(Collection<Issue> newIssues) {
        if (newIssues == null || newIssues.isEmpty()) {
            return this;
        }
        List<Issue> merged = new ArrayList<>(issues);
        merged.addAll(newIssues);
        return new Run(id, organizationId, productId, repositoryId, revision, status, jobConfigs,
            resolvedJobConfigs, labels, merged, jobConfigContext, resolvedJobConfigContext, traceId, currentStage);
    }

    /**
     * 주어진 심각도 이상의 Issue가 있는지 확인.
     *
     * @param threshold 기준 심각도
     * @return 하나라도 있으면 true
     */
    public boolean hasIssuesAtLeast(Severity threshold) {
        return issues.stream().anyMatch(issue -> issue.severity().isAtLeast(threshold));
    }
}
