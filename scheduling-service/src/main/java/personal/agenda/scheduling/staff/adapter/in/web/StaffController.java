package personal.agenda.scheduling.staff.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.agenda.scheduling.staff.adapter.in.web.dto.AddSkillRequest;
import personal.agenda.scheduling.staff.adapter.in.web.dto.ChangeActiveRequest;
import personal.agenda.scheduling.staff.adapter.in.web.dto.RegisterStaffRequest;
import personal.agenda.scheduling.staff.adapter.in.web.dto.StaffResponse;
import personal.agenda.scheduling.staff.adapter.in.web.dto.WorkDayDto;
import personal.agenda.scheduling.staff.adapter.in.web.dto.WorkScheduleRequest;
import personal.agenda.scheduling.staff.application.port.in.ManageStaffUseCase;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.util.List;

/**
 * Staff API Controller
 * 직원, 근무표, 스킬 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/staff")
@RequiredArgsConstructor
public class StaffController {

    private final ManageStaffUseCase manageStaffUseCase;

    @PostMapping
    public ResponseEntity<StaffResponse> registerStaff(
            @PathVariable String tenantId,
            @Valid @RequestBody RegisterStaffRequest request
    ) {
        log.info("Register staff: tenantId={}, name={}", tenantId, request.name());
        StaffMember staff = manageStaffUseCase.registerStaff(request.toCommand(tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(StaffResponse.from(staff));
    }

    @GetMapping
    public ResponseEntity<List<StaffResponse>> getStaffMembers(@PathVariable String tenantId) {
        List<StaffResponse> response = manageStaffUseCase.getStaffMembers(tenantId).stream()
                .map(StaffResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{staffId}")
    public ResponseEntity<StaffResponse> getStaff(@PathVariable String tenantId, @PathVariable Long staffId) {
        return ResponseEntity.ok(StaffResponse.from(manageStaffUseCase.getStaff(tenantId, staffId)));
    }

    /**
     * 근무표 변경
     * PUT /api/v1/tenants/{tenantId}/staff/{staffId}/work-schedule
     */
    @PutMapping("/{staffId}/work-schedule")
    public ResponseEntity<StaffResponse> changeWorkSchedule(
            @PathVariable String tenantId,
            @PathVariable Long staffId,
            @Valid @RequestBody WorkScheduleRequest request
    ) {
        log.info("Change work schedule: tenantId={}, staffId={}", tenantId, staffId);
        StaffMember staff = manageStaffUseCase.changeWorkSchedule(tenantId, staffId,
                WorkDayDto.toSchedule(request.days()));
        return ResponseEntity.ok(StaffResponse.from(staff));
    }

    /**
     * 활성/비활성 전환
     * PATCH /api/v1/tenants/{tenantId}/staff/{staffId}/active
     */
    @PatchMapping("/{staffId}/active")
    public ResponseEntity<StaffResponse> changeActive(
            @PathVariable String tenantId,
            @PathVariable Long staffId,
            @Valid @RequestBody ChangeActiveRequest request
    ) {
        log.info("Change staff active: tenantId={}, staffId={}, active={}", tenantId, staffId, request.active());
        StaffMember staff = manageStaffUseCase.changeActive(tenantId, staffId, request.active());
        return ResponseEntity.ok(StaffResponse.from(staff));
    }

    @DeleteMapping("/{staffId}")
    public ResponseEntity<Void> removeStaff(@PathVariable String tenantId, @PathVariable Long staffId) {
        log.info("Remove staff: tenantId={}, staffId={}", tenantId, staffId);
        manageStaffUseCase.removeStaff(tenantId, staffId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{staffId}/skills")
    public ResponseEntity<StaffResponse> addSkill(
            @PathVariable String tenantId,
            @PathVariable Long staffId,
            @Valid @RequestBody AddSkillRequest request
    ) {
        log.info("Add skill: tenantId={}, staffId={}, serviceId={}", tenantId, staffId, request.serviceId());
        StaffMember staff = manageStaffUseCase.addSkill(tenantId, staffId, request.serviceId(),
                request.experienceLevel(), request.durationOverride());
        return ResponseEntity.status(HttpStatus.CREATED).body(StaffResponse.from(staff));
    }

    @DeleteMapping("/{staffId}/skills/{serviceId}")
    public ResponseEntity<StaffResponse> removeSkill(
            @PathVariable String tenantId,
            @PathVariable Long staffId,
            @PathVariable Long serviceId
    ) {
        log.info("Remove skill: tenantId={}, staffId={}, serviceId={}", tenantId, staffId, serviceId);
        return ResponseEntity.ok(StaffResponse.from(manageStaffUseCase.removeSkill(tenantId, staffId, serviceId)));
    }
}
