package personal.agenda.scheduling.catalog.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Tenant JPA Entity
 * 예약 엔진은 존재 여부만 확인한다
 */
@Entity
@Table(name = "tenants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TenantEntity {

    @Id
    @Column(name = "tenant_id", length = 100)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    public TenantEntity(String id, String name) {
        this.id = id;
        this.name = name;
    }
}
