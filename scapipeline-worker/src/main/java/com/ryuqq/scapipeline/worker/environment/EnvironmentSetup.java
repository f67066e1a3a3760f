package com.ryuqq.scapipeline.worker.environment;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 단계 프로세스를 위해 준비된 환경.
 *
 * @param configDirectory 생성된 설정 파일이 있는 디렉터리 (컨텍스트 임시 디렉터리)
 * @param variables 단계 프로세스 환경 변수
 * @param generatedFiles 생성된 설정 파일
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EnvironmentSetup(Path configDirectory, Map<String, String> variables, List<Path> generatedFiles) {

    public EnvironmentSetup {
        if (configDirectory == null) {
            throw new IllegalArgumentException("configDirectory cannot be null");
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        generatedFiles = generatedFiles == null ? List.of() : List.copyOf(generatedFiles);
    }

    @Override
    public String toString() {
        return "EnvironmentSetup[configDirectory=" + configDirectory
            + ", variables=" + variables.keySet()
            + ", generatedFiles=" + generatedFiles + "]";
    }
}
