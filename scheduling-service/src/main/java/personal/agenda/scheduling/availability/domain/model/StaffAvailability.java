package personal.agenda.scheduling.availability.domain.model;

import personal.agenda.scheduling.booking.domain.model.Booking;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 직원의 특정 시각 가용 여부
 *
 * @param conflictingBooking 충돌한 예약 (CONFLICT인 경우)
 * @param suggestedTimes     불가한 경우 요청 시각에 가까운 대체 시작 시각 (HH:mm)
 */
public record StaffAvailability(
        Long staffId,
        LocalDate date,
        LocalTime startTime,
        int durationMinutes,
        AvailabilityStatus status,
        Booking conflictingBooking,
        List<String> suggestedTimes) {

    public StaffAvailability {
        suggestedTimes = suggestedTimes == null ? List.of() : List.copyOf(suggestedTimes);
    }

    public boolean available() {
        return status == AvailabilityStatus.AVAILABLE;
    }
}
