package personal.agenda.scheduling.staff.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.util.Map;

public record WorkScheduleRequest(
        @NotNull(message = "근무표는 필수입니다.")
        Map<DayOfWeek, WorkDayDto> days
) {
}
