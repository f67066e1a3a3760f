package com.ryuqq.scapipeline.core.model;

/**
 * 조직 (Hierarchy 최상위).
 *
 * @param id 조직 ID
 * @param name 조직 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Organization(long id, String name) {

    public Organization {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
