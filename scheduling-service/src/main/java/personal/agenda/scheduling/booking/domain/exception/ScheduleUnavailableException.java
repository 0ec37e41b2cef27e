package personal.agenda.scheduling.booking.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Schedule Unavailable Exception
 * 근무일이 아니거나, 근무 시간 밖이거나, 휴게 시간과 겹칠 때 발생
 */
public class ScheduleUnavailableException extends BusinessException {

    private ScheduleUnavailableException(String detail) {
        super(ErrorCode.SCHEDULE_UNAVAILABLE, detail);
    }

    public static ScheduleUnavailableException notWorking(Long staffId, LocalDate date) {
        return new ScheduleUnavailableException(
                String.format("Staff is not working on date: staffId=%d, date=%s", staffId, date));
    }

    public static ScheduleUnavailableException outsideWorkingHours(Long staffId, TimeWindow requested) {
        return new ScheduleUnavailableException(
                String.format("Requested time is outside working hours: staffId=%d, start=%s, end=%s",
                        staffId, requested.start(), requested.end()));
    }

    public static ScheduleUnavailableException duringBreak(Long staffId, TimeWindow requested) {
        return new ScheduleUnavailableException(
                String.format("Requested time overlaps break: staffId=%d, start=%s, end=%s",
                        staffId, requested.start(), requested.end()));
    }

    public static ScheduleUnavailableException crossesMidnight(LocalTime startTime, int durationMinutes) {
        return new ScheduleUnavailableException(
                String.format("Requested time crosses midnight: start=%s, duration=%d", startTime, durationMinutes));
    }
}
