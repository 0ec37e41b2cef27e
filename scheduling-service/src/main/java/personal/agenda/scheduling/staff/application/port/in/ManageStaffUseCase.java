package personal.agenda.scheduling.staff.application.port.in;

import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;
import personal.agenda.scheduling.staff.domain.model.StaffMember;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.util.List;

/**
 * Manage Staff UseCase (Input Port)
 * 직원/근무표/스킬 관리
 *
 * 모든 변경은 해당 직원과 테넌트 로스터 캐시를 무효화한다.
 */
public interface ManageStaffUseCase {

    StaffMember registerStaff(RegisterStaffCommand command);

    StaffMember getStaff(String tenantId, Long staffId);

    List<StaffMember> getStaffMembers(String tenantId);

    StaffMember changeWorkSchedule(String tenantId, Long staffId, WorkSchedule workSchedule);

    StaffMember changeActive(String tenantId, Long staffId, boolean active);

    void removeStaff(String tenantId, Long staffId);

    /**
     * @throws personal.agenda.scheduling.staff.domain.exception.SkillAlreadyAssignedException 이미 보유한 스킬일 때
     * @throws personal.agenda.scheduling.catalog.domain.exception.ServiceNotFoundException 테넌트에 서비스가 없을 때
     */
    StaffMember addSkill(String tenantId, Long staffId, Long serviceId,
                         ExperienceLevel experienceLevel, Integer durationOverride);

    StaffMember removeSkill(String tenantId, Long staffId, Long serviceId);
}
