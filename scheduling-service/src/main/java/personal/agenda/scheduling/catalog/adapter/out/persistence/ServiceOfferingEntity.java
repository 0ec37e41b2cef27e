package personal.agenda.scheduling.catalog.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;

import java.math.BigDecimal;

/**
 * Service Offering JPA Entity
 */
@Entity
@Table(name = "service_offerings",
        indexes = @Index(name = "idx_service_offerings_tenant", columnList = "tenant_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServiceOfferingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(nullable = false)
    private boolean active;

    public static ServiceOfferingEntity fromDomain(ServiceOffering service) {
        ServiceOfferingEntity entity = new ServiceOfferingEntity();
        entity.id = service.id();
        entity.tenantId = service.tenantId();
        entity.name = service.name();
        entity.price = service.price();
        entity.durationMinutes = service.durationMinutes();
        entity.active = service.active();
        return entity;
    }

    public ServiceOffering toDomain() {
        return new ServiceOffering(id, tenantId, name, price, durationMinutes, active);
    }
}
