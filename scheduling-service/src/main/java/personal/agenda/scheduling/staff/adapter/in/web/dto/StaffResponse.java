package personal.agenda.scheduling.staff.adapter.in.web.dto;

import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;
import personal.agenda.scheduling.staff.domain.model.Skill;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

/**
 * 직원 조회/등록 응답 DTO
 */
public record StaffResponse(
        Long staffId,
        String tenantId,
        String name,
        String email,
        String position,
        boolean active,
        List<SkillResponse> skills,
        Map<DayOfWeek, WorkDayDto> workSchedule
) {
    public record SkillResponse(
            Long serviceId,
            String serviceName,
            ExperienceLevel experienceLevel,
            Integer durationOverride,
            boolean canPerform
    ) {
        static SkillResponse from(Skill skill) {
            return new SkillResponse(skill.serviceId(), skill.serviceName(), skill.experienceLevel(),
                    skill.durationOverride(), skill.isPerformable());
        }
    }

    public static StaffResponse from(StaffMember staff) {
        return new StaffResponse(
                staff.id(),
                staff.tenantId(),
                staff.name(),
                staff.email(),
                staff.position(),
                staff.active(),
                staff.skills().stream().map(SkillResponse::from).toList(),
                WorkDayDto.fromSchedule(staff.workSchedule())
        );
    }
}
