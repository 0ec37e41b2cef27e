package personal.agenda.scheduling.catalog.adapter.out.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.agenda.scheduling.support.SchedulingFixtures.*;

@DataJpaTest
@Import(CatalogPersistenceAdapter.class)
@DisplayName("CatalogPersistenceAdapter 테스트")
class CatalogPersistenceAdapterTest {

    @Autowired
    private CatalogPersistenceAdapter catalogPersistenceAdapter;
    @Autowired
    private JpaTenantRepository jpaTenantRepository;
    @Autowired
    private JpaServiceOfferingRepository jpaServiceOfferingRepository;

    @Test
    @DisplayName("테넌트 존재 여부를 확인한다")
    void exists() {
        jpaTenantRepository.save(new TenantEntity(TENANT_ID, "헤어살롱"));

        assertThat(catalogPersistenceAdapter.exists(TENANT_ID)).isTrue();
        assertThat(catalogPersistenceAdapter.exists(OTHER_TENANT_ID)).isFalse();
    }

    @Test
    @DisplayName("서비스는 같은 테넌트에서만 조회된다")
    void findServiceWithinTenant() {
        // given
        ServiceOfferingEntity saved = jpaServiceOfferingRepository.save(ServiceOfferingEntity.fromDomain(
                new ServiceOffering(null, TENANT_ID, "커트", new BigDecimal("20000"), 30, true)));

        // when & then
        assertThat(catalogPersistenceAdapter.findById(TENANT_ID, saved.getId()))
                .hasValueSatisfying(service -> {
                    assertThat(service.name()).isEqualTo("커트");
                    assertThat(service.durationMinutes()).isEqualTo(30);
                });
        assertThat(catalogPersistenceAdapter.findById(OTHER_TENANT_ID, saved.getId())).isEmpty();
    }
}
