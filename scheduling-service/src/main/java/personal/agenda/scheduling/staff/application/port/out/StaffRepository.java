package personal.agenda.scheduling.staff.application.port.out;

import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.util.List;
import java.util.Optional;

/**
 * Staff Repository Port (Output Port)
 */
public interface StaffRepository {

    StaffMember save(StaffMember staff);

    Optional<StaffMember> findById(Long staffId);

    /**
     * 테넌트 소속 직원 전체 (이름순)
     */
    List<StaffMember> findAllByTenantId(String tenantId);

    void deleteById(Long staffId);
}
