package com.ryuqq.scapipeline.core.model;

/**
 * 외부 secret store 안의 secret 위치.
 *
 * <p>새로 만드는 secret의 저장 위치는 {@code {scope}_{scopeId}_{name}} 규칙을 따릅니다.</p>
 * <pre>
 * SecretPath.forScope(SecretScope.ORGANIZATION, 42, "npmToken").path()
 *     // "organization_42_npmToken"
 * </pre>
 *
 * @param path secret store 경로
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SecretPath(String path) {

    public SecretPath {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
    }

    /**
     * scope 규칙으로 secret 경로 생성.
     *
     * @param scope secret scope
     * @param scopeId scope 엔티티 ID
     * @param name secret 이름
     * @return SecretPath
     * @throws IllegalArgumentException scope가 null이거나 name이 빈 문자열인 경우
     */
    public static SecretPath forScope(SecretScope scope, long scopeId, String name) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return new SecretPath(scope.prefix() + "_" + scopeId + "_" + name);
    }

    @Override
    public String toString() {
        return path;
    }
}
