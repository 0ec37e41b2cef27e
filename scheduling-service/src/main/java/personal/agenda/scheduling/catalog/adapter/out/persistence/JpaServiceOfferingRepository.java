package personal.agenda.scheduling.catalog.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Service Offering
 */
public interface JpaServiceOfferingRepository extends JpaRepository<ServiceOfferingEntity, Long> {

    Optional<ServiceOfferingEntity> findByIdAndTenantId(Long id, String tenantId);
}
