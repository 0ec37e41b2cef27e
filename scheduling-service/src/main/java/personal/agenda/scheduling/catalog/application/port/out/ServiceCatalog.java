package personal.agenda.scheduling.catalog.application.port.out;

import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;

import java.util.Optional;

/**
 * Service Catalog Port (Output Port)
 */
public interface ServiceCatalog {

    /**
     * 테넌트 범위에서 서비스 조회
     * 다른 테넌트의 서비스는 조회되지 않는다
     */
    Optional<ServiceOffering> findById(String tenantId, Long serviceId);
}
