package com.ryuqq.scapipeline.adapter.inmemory.store;

import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.core.spi.InfrastructureServiceRepository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link InfrastructureServiceRepository}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryInfrastructureServiceRepository implements InfrastructureServiceRepository {

    private final List<InfrastructureService> services = new CopyOnWriteArrayList<>();

    /**
     * Add a product or organization scoped service.
     *
     * @param service service with a product or organization id
     * @throws IllegalArgumentException if the service has neither scope id
     */
    public void add(InfrastructureService service) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (service.productId() == null && service.organizationId() == null) {
            throw new IllegalArgumentException("Service '" + service.name() + "' has no product or organization scope");
        }
        services.add(service);
    }

    @Override
    public List<InfrastructureService> listForProduct(long productId) {
        return services.stream()
            .filter(service -> service.productId() != null && service.productId() == productId)
            .toList();
    }

    @Override
    public List<InfrastructureService> listForOrganization(long organizationId) {
        return services.stream()
            .filter(service -> service.organizationId() != null && service.organizationId() == organizationId)
            .toList();
    }
}
