package personal.agenda.scheduling.booking.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.service.ConflictChecker;

import java.time.LocalTime;

/**
 * 하루 안의 반개구간 [start, end)
 * 자정을 넘는 구간은 표현하지 않는다
 */
public record TimeWindow(LocalTime start, LocalTime end) {

    public static final int MINUTES_PER_DAY = 24 * 60;

    public TimeWindow {
        if (start == null || end == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Window boundaries cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Window start must be before end: start=%s, end=%s", start, end));
        }
    }

    /**
     * 시작 시각과 소요 시간으로 구간 생성
     *
     * @throws BusinessException 소요 시간이 0 이하이거나 자정을 넘는 경우
     */
    public static TimeWindow starting(LocalTime start, int durationMinutes) {
        if (!fitsWithinDay(start, durationMinutes)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Window does not fit within the day: start=%s, duration=%d",
                            start, durationMinutes));
        }
        return new TimeWindow(start, start.plusMinutes(durationMinutes));
    }

    public static boolean fitsWithinDay(LocalTime start, int durationMinutes) {
        // 덧셈 대신 남은 분과 비교 (큰 소요 시간의 int 오버플로 방지)
        return durationMinutes > 0 && durationMinutes < MINUTES_PER_DAY - minuteOfDay(start);
    }

    public static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    public boolean overlaps(TimeWindow other) {
        return ConflictChecker.overlaps(start, end, other.start, other.end);
    }

    public boolean contains(TimeWindow other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public int durationMinutes() {
        return minuteOfDay(end) - minuteOfDay(start);
    }
}
