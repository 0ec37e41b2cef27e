package personal.agenda.scheduling.staff.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for Staff Member
 */
public interface JpaStaffMemberRepository extends JpaRepository<StaffMemberEntity, Long> {

    List<StaffMemberEntity> findAllByTenantIdOrderByNameAsc(String tenantId);
}
