package personal.agenda.scheduling.staff.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;
import personal.agenda.scheduling.catalog.application.port.out.ServiceCatalog;
import personal.agenda.scheduling.catalog.application.port.out.TenantDirectory;
import personal.agenda.scheduling.catalog.domain.exception.ServiceNotFoundException;
import personal.agenda.scheduling.catalog.domain.exception.TenantNotFoundException;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;
import personal.agenda.scheduling.staff.application.port.in.ManageStaffUseCase;
import personal.agenda.scheduling.staff.application.port.in.RegisterStaffCommand;
import personal.agenda.scheduling.staff.application.port.out.StaffRepository;
import personal.agenda.scheduling.staff.domain.exception.StaffNotFoundException;
import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;
import personal.agenda.scheduling.staff.domain.model.Skill;
import personal.agenda.scheduling.staff.domain.model.StaffMember;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Staff Management Service
 * 직원 등록/수정/삭제, 스킬 추가/제거
 *
 * 변경 후 캐시 무효화: 테넌트 로스터 전체 + 해당 직원 정보/슬롯
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaffManagementService implements ManageStaffUseCase {

    private final StaffRepository staffRepository;
    private final TenantDirectory tenantDirectory;
    private final ServiceCatalog serviceCatalog;
    private final AvailabilityCacheRepository availabilityCache;

    @Override
    @Transactional
    public StaffMember registerStaff(RegisterStaffCommand command) {
        ensureTenantExists(command.tenantId());

        StaffMember saved = staffRepository.save(StaffMember.register(
                command.tenantId(), command.name(), command.email(), command.position(), command.workSchedule()));
        availabilityCache.invalidateStaff(saved.tenantId(), saved.id());

        log.info("Staff registered: tenantId={}, staffId={}, name={}", saved.tenantId(), saved.id(), saved.name());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public StaffMember getStaff(String tenantId, Long staffId) {
        return findTenantStaff(tenantId, staffId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StaffMember> getStaffMembers(String tenantId) {
        ensureTenantExists(tenantId);
        return staffRepository.findAllByTenantId(tenantId);
    }

    @Override
    @Transactional
    public StaffMember changeWorkSchedule(String tenantId, Long staffId, WorkSchedule workSchedule) {
        return update(tenantId, staffId, staff -> staff.changeWorkSchedule(workSchedule));
    }

    @Override
    @Transactional
    public StaffMember changeActive(String tenantId, Long staffId, boolean active) {
        return update(tenantId, staffId, staff -> staff.changeActive(active));
    }

    @Override
    @Transactional
    public void removeStaff(String tenantId, Long staffId) {
        StaffMember staff = findTenantStaff(tenantId, staffId);
        staffRepository.deleteById(staff.id());
        availabilityCache.invalidateStaff(tenantId, staffId);
        log.info("Staff removed: tenantId={}, staffId={}", tenantId, staffId);
    }

    @Override
    @Transactional
    public StaffMember addSkill(String tenantId, Long staffId, Long serviceId,
                                ExperienceLevel experienceLevel, Integer durationOverride) {
        ServiceOffering service = serviceCatalog.findById(tenantId, serviceId)
                .orElseThrow(() -> new ServiceNotFoundException(tenantId, serviceId));
        Skill skill = new Skill(service.id(), service.name(), experienceLevel, durationOverride, true);
        return update(tenantId, staffId, staff -> staff.addSkill(skill));
    }

    @Override
    @Transactional
    public StaffMember removeSkill(String tenantId, Long staffId, Long serviceId) {
        return update(tenantId, staffId, staff -> staff.removeSkill(serviceId));
    }

    private StaffMember update(String tenantId, Long staffId, UnaryOperator<StaffMember> change) {
        StaffMember updated = change.apply(findTenantStaff(tenantId, staffId));
        StaffMember saved = staffRepository.save(updated);
        availabilityCache.invalidateStaff(tenantId, staffId);

        log.info("Staff updated: tenantId={}, staffId={}, active={}, skillCount={}",
                tenantId, staffId, saved.active(), saved.skills().size());
        return saved;
    }

    private StaffMember findTenantStaff(String tenantId, Long staffId) {
        return staffRepository.findById(staffId)
                .filter(staff -> staff.belongsTo(tenantId))
                .orElseThrow(() -> new StaffNotFoundException(staffId));
    }

    private void ensureTenantExists(String tenantId) {
        if (!tenantDirectory.exists(tenantId)) {
            throw new TenantNotFoundException(tenantId);
        }
    }
}
