package com.ryuqq.scapipeline.core.model;

/**
 * 조직 → 제품 → 저장소 소유 관계.
 *
 * <p>Run에 대해 한 번 해석되면 변경되지 않으며, secret과 infrastructure service를
 * 찾는 scope 체인으로 사용됩니다 (저장소 → 제품 → 조직 순).</p>
 *
 * @param repository 저장소
 * @param product 제품
 * @param organization 조직
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Hierarchy(
    Repository repository,
    Product product,
    Organization organization
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 ID 체인이 일치하지 않는 경우
     */
    public Hierarchy {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (product == null) {
            throw new IllegalArgumentException("product cannot be null");
        }
        if (organization == null) {
            throw new IllegalArgumentException("organization cannot be null");
        }
        if (repository.productId() != product.id() || product.organizationId() != organization.id()) {
            throw new IllegalArgumentException(
                "Inconsistent hierarchy (repository: " + repository.id() + ", product: " + product.id()
                    + ", organization: " + organization.id() + ")"
            );
        }
    }
}
