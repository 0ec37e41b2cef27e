package personal.agenda.scheduling.availability.domain.model;

import personal.agenda.scheduling.booking.domain.model.TimeWindow;

import java.util.Optional;

/**
 * 특정 날짜의 근무 구간과 휴게 구간
 *
 * @param workingHours 근무 구간
 * @param breakTime    휴게 구간, 없으면 null
 */
public record WorkingDay(TimeWindow workingHours, TimeWindow breakTime) {

    public Optional<TimeWindow> breakWindow() {
        return Optional.ofNullable(breakTime);
    }
}
