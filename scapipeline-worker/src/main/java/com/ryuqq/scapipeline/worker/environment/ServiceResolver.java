package com.ryuqq.scapipeline.worker.environment;

import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.InfrastructureService;
import com.ryuqq.scapipeline.core.outcome.Fail;
import com.ryuqq.scapipeline.core.outcome.Ok;
import com.ryuqq.scapipeline.core.outcome.Outcome;
import com.ryuqq.scapipeline.core.spi.InfrastructureServiceRepository;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentDefinitionFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * definition이 참조하는 서비스를 저장소 설정 → 제품 → 조직 순서로 찾습니다.
 *
 * <p>제품/조직 서비스는 처음 필요할 때 한 번만 조회합니다.</p>
 */
final class ServiceResolver {

    static final String ERROR_MISSING_SERVICE = "ENV_SERVICE_MISSING_REFERENCE";
    static final String ERROR_UNKNOWN_SERVICE = "ENV_SERVICE_UNKNOWN";

    private final Hierarchy hierarchy;
    private final InfrastructureServiceRepository serviceRepository;
    private final Map<String, InfrastructureService> repositoryServices;
    private Map<String, InfrastructureService> productServices;
    private Map<String, InfrastructureService> organizationServices;

    ServiceResolver(
        Hierarchy hierarchy,
        InfrastructureServiceRepository serviceRepository,
        List<InfrastructureService> configServices
    ) {
        this.hierarchy = hierarchy;
        this.serviceRepository = serviceRepository;
        this.repositoryServices = byName(configServices);
    }

    Outcome<InfrastructureService> resolveService(Map<String, String> properties) {
        String serviceName = properties.get(EnvironmentDefinitionFactory.SERVICE_PROPERTY);
        if (serviceName == null) {
            return Fail.of(ERROR_MISSING_SERVICE, "Missing service reference: " + properties);
        }

        InfrastructureService service = repositoryServices.get(serviceName);
        if (service == null) {
            service = productServices().get(serviceName);
        }
        if (service == null) {
            service = organizationServices().get(serviceName);
        }
        if (service == null) {
            return Fail.of(ERROR_UNKNOWN_SERVICE, "Unknown service: '" + serviceName + "'.");
        }
        return Ok.of(service);
    }

    private Map<String, InfrastructureService> productServices() {
        if (productServices == null) {
            productServices = byName(serviceRepository.listForProduct(hierarchy.product().id()));
        }
        return productServices;
    }

    private Map<String, InfrastructureService> organizationServices() {
        if (organizationServices == null) {
            organizationServices = byName(serviceRepository.listForOrganization(hierarchy.organization().id()));
        }
        return organizationServices;
    }

    private static Map<String, InfrastructureService> byName(Collection<InfrastructureService> services) {
        Map<String, InfrastructureService> map = new LinkedHashMap<>();
        for (InfrastructureService service : services) {
            map.put(service.name(), service);
        }
        return map;
    }
}
