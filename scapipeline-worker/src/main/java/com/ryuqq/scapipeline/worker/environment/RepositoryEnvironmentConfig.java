package com.ryuqq.scapipeline.worker.environment;

import com.ryuqq.scapipeline.core.model.CredentialsType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 저장소 environment configuration 파일 ({@code .ort.env.yml}) 구조.
 *
 * <p>YAML 파일에서 역직렬화되거나, Run 생성 시 전달된 설정으로부터 직접 생성됩니다.
 * 참조는 아직 해석되지 않은 상태(secret 이름, 서비스 이름)입니다.</p>
 *
 * <pre>
 * strict: false
 * infrastructureServices:
 * - name: "JFrog"
 *   url: "https://artifactory.example.org/repositories"
 *   usernameSecret: "frogUsername"
 *   passwordSecret: "frogPassword"
 *   credentialsTypes: ["NETRC_FILE"]
 * environmentDefinitions:
 *   maven:
 *   - service: "JFrog"
 *     id: "releasesRepo"
 * environmentVariables:
 * - name: "REPOSITORY_PASSWORD"
 *   secretName: "frogPassword"
 * - name: "BUILD_MODE"
 *   value: "offline"
 * </pre>
 *
 * @param strict true면 해석 불가 참조가 치명적 오류 (기본값 true)
 * @param infrastructureServices 저장소 전용 서비스 선언
 * @param environmentDefinitions 패키지 매니저 타입별 definition 속성 목록
 * @param environmentVariables 환경 변수 선언
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RepositoryEnvironmentConfig(
    Boolean strict,
    List<RepositoryInfrastructureService> infrastructureServices,
    Map<String, List<Map<String, String>>> environmentDefinitions,
    List<RepositoryEnvironmentVariable> environmentVariables
) {

    public RepositoryEnvironmentConfig {
        strict = strict == null ? Boolean.TRUE : strict;
        infrastructureServices = infrastructureServices == null ? List.of() : List.copyOf(infrastructureServices);
        environmentVariables = environmentVariables == null ? List.of() : List.copyOf(environmentVariables);
        if (environmentDefinitions == null) {
            environmentDefinitions = Map.of();
        } else {
            Map<String, List<Map<String, String>>> copy = new LinkedHashMap<>();
            environmentDefinitions.forEach((type, entries) -> {
                List<Map<String, String>> entriesCopy = new ArrayList<>();
                if (entries != null) {
                    entries.forEach(entry -> entriesCopy.add(entry == null ? Map.of() : new LinkedHashMap<>(entry)));
                }
                copy.put(type, Collections.unmodifiableList(entriesCopy));
            });
            environmentDefinitions = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * 빈 설정 (strict).
     *
     * @return 빈 설정
     */
    public static RepositoryEnvironmentConfig empty() {
        return new RepositoryEnvironmentConfig(true, List.of(), Map.of(), List.of());
    }

    /**
     * 설정 파일에 선언된 서비스.
     *
     * @param name 이름
     * @param url URL
     * @param description 설명 (null 가능)
     * @param usernameSecret 사용자 이름 secret 이름
     * @param passwordSecret 비밀번호 secret 이름
     * @param credentialsTypes 자격 증명 노출 방식
     */
    public record RepositoryInfrastructureService(
        String name,
        String url,
        String description,
        String usernameSecret,
        String passwordSecret,
        Set<CredentialsType> credentialsTypes
    ) {

        public RepositoryInfrastructureService {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url cannot be null or blank");
            }
            if (usernameSecret == null || usernameSecret.isBlank()) {
                throw new IllegalArgumentException("usernameSecret cannot be null or blank");
            }
            if (passwordSecret == null || passwordSecret.isBlank()) {
                throw new IllegalArgumentException("passwordSecret cannot be null or blank");
            }
            credentialsTypes = credentialsTypes == null ? Set.of() : Set.copyOf(credentialsTypes);
        }
    }

    /**
     * 설정 파일에 선언된 환경 변수. {@code secretName}과 {@code value} 중 정확히 하나가 설정됩니다.
     *
     * @param name 변수 이름
     * @param secretName 값을 가진 secret 이름 (null 가능)
     * @param value 리터럴 값 (null 가능)
     */
    public record RepositoryEnvironmentVariable(String name, String secretName, String value) {

        public RepositoryEnvironmentVariable {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if ((secretName == null) == (value == null)) {
                throw new IllegalArgumentException(
                    "Environment variable '" + name + "' must define exactly one of secretName or value"
                );
            }
        }

        public static RepositoryEnvironmentVariable ofSecret(String name, String secretName) {
            return new RepositoryEnvironmentVariable(name, secretName, null);
        }

        public boolean referencesSecret() {
            return secretName != null;
        }

        @Override
        public String toString() {
            return secretName != null
                ? "RepositoryEnvironmentVariable[name=" + name + ", secretName=" + secretName + "]"
                : "RepositoryEnvironmentVariable[name=" + name + "]";
        }
    }
}
