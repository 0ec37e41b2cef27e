package personal.agenda.scheduling.availability.adapter.in.web.dto;

import personal.agenda.scheduling.availability.domain.model.AvailableStaff;
import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;

import java.math.BigDecimal;

public record AvailableStaffResponse(
        Long staffId,
        String name,
        String position,
        ExperienceLevel experienceLevel,
        int durationMinutes,
        BigDecimal price
) {
    public static AvailableStaffResponse from(AvailableStaff staff) {
        return new AvailableStaffResponse(
                staff.staffId(),
                staff.name(),
                staff.position(),
                staff.experienceLevel(),
                staff.durationMinutes(),
                staff.price()
        );
    }
}
