package personal.agenda.scheduling.staff.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import personal.agenda.scheduling.staff.application.port.in.RegisterStaffCommand;

import java.time.DayOfWeek;
import java.util.Map;

/**
 * 직원 등록 요청 DTO
 */
public record RegisterStaffRequest(
        @NotBlank(message = "직원 이름은 필수입니다.")
        String name,

        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String email,

        String position,

        Map<DayOfWeek, WorkDayDto> workSchedule
) {
    public RegisterStaffCommand toCommand(String tenantId) {
        return new RegisterStaffCommand(tenantId, name, email, position, WorkDayDto.toSchedule(workSchedule));
    }
}
