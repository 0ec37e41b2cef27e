package personal.agenda.scheduling.staff.domain.model;

import java.time.LocalTime;

/**
 * 요일별 근무 정보 (벽시계 시간, 타임존 변환 없음)
 */
public record DaySchedule(
        boolean working,
        LocalTime startTime,
        LocalTime endTime,
        LocalTime breakStart,
        LocalTime breakEnd) {

    public static DaySchedule off() {
        return new DaySchedule(false, null, null, null, null);
    }

    public static DaySchedule of(LocalTime startTime, LocalTime endTime) {
        return new DaySchedule(true, startTime, endTime, null, null);
    }

    public static DaySchedule withBreak(LocalTime startTime, LocalTime endTime,
                                        LocalTime breakStart, LocalTime breakEnd) {
        return new DaySchedule(true, startTime, endTime, breakStart, breakEnd);
    }

    /**
     * 근무 플래그가 켜져 있고 시작/종료 시간이 유효한 경우
     */
    public boolean hasWorkingHours() {
        return working && startTime != null && endTime != null && startTime.isBefore(endTime);
    }

    public boolean hasBreak() {
        return breakStart != null && breakEnd != null && breakStart.isBefore(breakEnd);
    }
}
