package personal.agenda.scheduling.catalog.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Tenant
 */
public interface JpaTenantRepository extends JpaRepository<TenantEntity, String> {
}
