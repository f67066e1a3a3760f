package com.ryuqq.scapipeline.core.model;

/**
 * 분석 대상 소스 저장소 (제품 하위).
 *
 * @param id 저장소 ID
 * @param organizationId 소속 조직 ID
 * @param productId 소속 제품 ID
 * @param url 저장소 URL
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Repository(long id, long organizationId, long productId, String url) {

    public Repository {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
    }
}
