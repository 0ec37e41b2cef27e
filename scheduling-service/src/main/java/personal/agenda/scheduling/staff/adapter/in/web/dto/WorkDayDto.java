package personal.agenda.scheduling.staff.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import personal.agenda.scheduling.staff.domain.model.DaySchedule;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * 요일별 근무 정보 DTO (요청/응답 공용)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkDayDto(
        boolean working,
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,
        @JsonFormat(pattern = "HH:mm")
        LocalTime breakStart,
        @JsonFormat(pattern = "HH:mm")
        LocalTime breakEnd
) {
    public static WorkDayDto from(DaySchedule day) {
        return new WorkDayDto(day.working(), day.startTime(), day.endTime(), day.breakStart(), day.breakEnd());
    }

    public DaySchedule toDomain() {
        return new DaySchedule(working, startTime, endTime, breakStart, breakEnd);
    }

    public static WorkSchedule toSchedule(Map<DayOfWeek, WorkDayDto> days) {
        if (days == null) {
            return WorkSchedule.empty();
        }
        Map<DayOfWeek, DaySchedule> schedule = new EnumMap<>(DayOfWeek.class);
        days.forEach((day, dto) -> schedule.put(day, dto.toDomain()));
        return new WorkSchedule(schedule);
    }

    public static Map<DayOfWeek, WorkDayDto> fromSchedule(WorkSchedule schedule) {
        Map<DayOfWeek, WorkDayDto> days = new EnumMap<>(DayOfWeek.class);
        schedule.days().forEach((day, daySchedule) -> days.put(day, from(daySchedule)));
        return days;
    }
}
