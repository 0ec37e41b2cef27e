package personal.agenda.scheduling.staff.domain.model;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 주간 근무표 (요일 → 근무 정보)
 */
public record WorkSchedule(Map<DayOfWeek, DaySchedule> days) {

    public WorkSchedule {
        days = days == null ? Map.of() : Map.copyOf(days);
    }

    public static WorkSchedule empty() {
        return new WorkSchedule(Map.of());
    }

    /**
     * 지정한 요일에 동일한 근무 정보를 적용한 근무표
     */
    public static WorkSchedule weekly(Set<DayOfWeek> workingDays, DaySchedule daySchedule) {
        Map<DayOfWeek, DaySchedule> days = new EnumMap<>(DayOfWeek.class);
        workingDays.forEach(day -> days.put(day, daySchedule));
        return new WorkSchedule(days);
    }

    public Optional<DaySchedule> forDay(DayOfWeek dayOfWeek) {
        return Optional.ofNullable(days.get(dayOfWeek));
    }
}
