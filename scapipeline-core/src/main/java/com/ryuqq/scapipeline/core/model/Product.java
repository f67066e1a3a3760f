package com.ryuqq.scapipeline.core.model;

/**
 * 제품 (조직 하위).
 *
 * @param id 제품 ID
 * @param organizationId 소속 조직 ID
 * @param name 제품 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Product(long id, long organizationId, String name) {

    public Product {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
