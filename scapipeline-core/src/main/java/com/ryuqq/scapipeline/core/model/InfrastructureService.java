package com.ryuqq.scapipeline.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 자격 증명이 필요한 외부 시스템 (예: artifact repository).
 *
 * <p>조직/제품 scope에 선언되거나 저장소의 environment configuration 파일에 인라인으로 선언됩니다.
 * 파일에 선언된 서비스는 organizationId와 productId가 모두 null입니다.</p>
 *
 * @param name 선언 scope 안에서 고유한 이름
 * @param url 서비스 URL
 * @param description 설명 (null 가능)
 * @param usernameSecret 사용자 이름 secret
 * @param passwordSecret 비밀번호 secret
 * @param organizationId 조직 scope ID (null 가능)
 * @param productId 제품 scope ID (null 가능)
 * @param credentialsTypes 자격 증명 노출 방식
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InfrastructureService(
    String name,
    String url,
    String description,
    Secret usernameSecret,
    Secret passwordSecret,
    Long organizationId,
    Long productId,
    Set<CredentialsType> credentialsTypes
) {

    public InfrastructureService {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (usernameSecret == null) {
            throw new IllegalArgumentException("usernameSecret cannot be null");
        }
        if (passwordSecret == null) {
            throw new IllegalArgumentException("passwordSecret cannot be null");
        }
        credentialsTypes = credentialsTypes == null || credentialsTypes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(credentialsTypes));
    }

    /**
     * 주어진 방식으로 자격 증명을 노출해야 하는지 확인.
     *
     * @param type 노출 방식
     * @return 포함되어 있으면 true
     */
    public boolean exposes(CredentialsType type) {
        return credentialsTypes.contains(type);
    }
}
