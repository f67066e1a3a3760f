package com.ryuqq.scapipeline.core.model;

/**
 * 외부 secret store 값에 대한 이름 있는 참조.
 *
 * <p>값 자체는 데이터 모델에 포함되지 않습니다. 정확히 하나의 scope ID가 설정됩니다.</p>
 *
 * @param id secret ID
 * @param path secret store 경로
 * @param name 선언 scope 안에서 고유한 이름
 * @param description 설명 (null 가능)
 * @param organizationId 조직 scope인 경우 조직 ID
 * @param productId 제품 scope인 경우 제품 ID
 * @param repositoryId 저장소 scope인 경우 저장소 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Secret(
    long id,
    SecretPath path,
    String name,
    String description,
    Long organizationId,
    Long productId,
    Long repositoryId
) {

    public Secret {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        int scopes = (organizationId != null ? 1 : 0) + (productId != null ? 1 : 0) + (repositoryId != null ? 1 : 0);
        if (scopes != 1) {
            throw new IllegalArgumentException("Secret '" + name + "' must belong to exactly one scope");
        }
    }

    /**
     * scope 규칙에 따른 경로로 secret 생성.
     *
     * @param id secret ID
     * @param scope 선언 scope
     * @param scopeId scope 엔티티 ID
     * @param name 이름
     * @param description 설명
     * @return Secret
     */
    public static Secret create(long id, SecretScope scope, long scopeId, String name, String description) {
        SecretPath path = SecretPath.forScope(scope, scopeId, name);
        return switch (scope) {
            case ORGANIZATION -> new Secret(id, path, name, description, scopeId, null, null);
            case PRODUCT -> new Secret(id, path, name, description, null, scopeId, null);
            case REPOSITORY -> new Secret(id, path, name, description, null, null, scopeId);
        };
    }
}
