package personal.agenda.scheduling.catalog.adapter.out.persistence;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.agenda.scheduling.catalog.application.port.out.ServiceCatalog;
import personal.agenda.scheduling.catalog.application.port.out.TenantDirectory;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;

import java.util.Optional;

/**
 * Catalog Persistence Adapter
 * 테넌트 디렉터리와 서비스 카탈로그 조회 구현체
 */
@Component
@RequiredArgsConstructor
public class CatalogPersistenceAdapter implements ServiceCatalog, TenantDirectory {

    private final JpaTenantRepository jpaTenantRepository;
    private final JpaServiceOfferingRepository jpaServiceOfferingRepository;

    @Override
    @Retry(name = "storeRead")
    public Optional<ServiceOffering> findById(String tenantId, Long serviceId) {
        return jpaServiceOfferingRepository.findByIdAndTenantId(serviceId, tenantId)
                .map(ServiceOfferingEntity::toDomain);
    }

    @Override
    @Retry(name = "storeRead")
    public boolean exists(String tenantId) {
        return jpaTenantRepository.existsById(tenantId);
    }
}
