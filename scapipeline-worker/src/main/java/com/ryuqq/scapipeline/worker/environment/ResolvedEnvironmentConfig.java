package com.ryuqq.scapipeline.worker.environment;

import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentServiceDefinition;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentVariableDefinition;

import java.util.List;
import java.util.Set;

/**
 * 모든 참조가 해석된 environment configuration.
 *
 * @param infrastructureServices 설정 파일에 선언되어 두 secret이 모두 해석된 서비스
 * @param environmentDefinitions 서비스가 해석된 definition
 * @param environmentVariables 값 출처가 해석된 환경 변수
 * @param warnings lenient 모드에서 제외된 선언에 대한 경고 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResolvedEnvironmentConfig(
    List<InfrastructureService> infrastructureServices,
    List<EnvironmentServiceDefinition> environmentDefinitions,
    Set<EnvironmentVariableDefinition> environmentVariables,
    List<String> warnings
) {

    public ResolvedEnvironmentConfig {
        infrastructureServices = infrastructureServices == null ? List.of() : List.copyOf(infrastructureServices);
        environmentDefinitions = environmentDefinitions == null ? List.of() : List.copyOf(environmentDefinitions);
        environmentVariables = environmentVariables == null ? Set.of() : Set.copyOf(environmentVariables);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ResolvedEnvironmentConfig empty() {
        return new ResolvedEnvironmentConfig(List.of(), List.of(), Set.of(), List.of());
    }

    public boolean isEmpty() {
        return infrastructureServices.isEmpty() && environmentDefinitions.isEmpty() && environmentVariables.isEmpty();
    }
}
