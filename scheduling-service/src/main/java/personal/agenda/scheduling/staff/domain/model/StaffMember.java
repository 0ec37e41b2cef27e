package personal.agenda.scheduling.staff.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.staff.domain.exception.SkillAlreadyAssignedException;
import personal.agenda.scheduling.staff.domain.exception.SkillMismatchException;
import personal.agenda.scheduling.staff.domain.exception.StaffInactiveException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Staff Member Domain Model
 * 테넌트에 소속된 직원 (불변)
 */
public record StaffMember(
        Long id,
        String tenantId,
        String name,
        String email,
        String position,
        boolean active,
        List<Skill> skills,
        WorkSchedule workSchedule) {

    public StaffMember {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff name cannot be blank");
        }
        skills = skills == null ? List.of() : List.copyOf(skills);
        workSchedule = workSchedule == null ? WorkSchedule.empty() : workSchedule;
    }

    /**
     * 신규 직원 등록 (활성 상태, 보유 스킬 없음)
     */
    public static StaffMember register(String tenantId, String name, String email, String position,
                                       WorkSchedule workSchedule) {
        return new StaffMember(null, tenantId, name, email, position, true, List.of(), workSchedule);
    }

    public boolean belongsTo(String tenantId) {
        return this.tenantId.equals(tenantId);
    }

    public Optional<Skill> findSkill(Long serviceId) {
        return skills.stream()
                .filter(skill -> skill.isFor(serviceId))
                .findFirst();
    }

    /**
     * 수행 가능한 스킬 조회 (canPerform=false인 스킬은 제외)
     */
    public Optional<Skill> findPerformableSkill(Long serviceId) {
        return skills.stream()
                .filter(skill -> skill.isFor(serviceId) && skill.isPerformable())
                .findFirst();
    }

    // ========== Domain Validation Methods ==========

    /**
     * @throws StaffInactiveException 비활성 직원일 때
     */
    public void ensureActive() {
        if (!active) {
            throw new StaffInactiveException(id);
        }
    }

    /**
     * @return 해당 서비스의 스킬
     * @throws SkillMismatchException 수행 가능한 스킬이 없을 때
     */
    public Skill ensureCapableOf(Long serviceId) {
        return findPerformableSkill(serviceId)
                .orElseThrow(() -> new SkillMismatchException(id, serviceId));
    }

    // ========== State Changes ==========

    public StaffMember addSkill(Skill skill) {
        if (findSkill(skill.serviceId()).isPresent()) {
            throw new SkillAlreadyAssignedException(id, skill.serviceId());
        }
        List<Skill> updated = new ArrayList<>(skills);
        updated.add(skill);
        return new StaffMember(id, tenantId, name, email, position, active, updated, workSchedule);
    }

    public StaffMember removeSkill(Long serviceId) {
        List<Skill> updated = skills.stream()
                .filter(skill -> !skill.isFor(serviceId))
                .toList();
        return new StaffMember(id, tenantId, name, email, position, active, updated, workSchedule);
    }

    public StaffMember changeWorkSchedule(WorkSchedule schedule) {
        return new StaffMember(id, tenantId, name, email, position, active, skills, schedule);
    }

    public StaffMember changeActive(boolean newActive) {
        return new StaffMember(id, tenantId, name, email, position, newActive, skills, workSchedule);
    }
}
