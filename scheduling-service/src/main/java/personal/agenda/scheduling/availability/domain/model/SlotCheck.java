package personal.agenda.scheduling.availability.domain.model;

import personal.agenda.scheduling.booking.domain.model.Booking;

/**
 * 후보 구간 평가 결과
 *
 * @param status             판정 결과
 * @param conflictingBooking CONFLICT인 경우 충돌한 예약
 */
public record SlotCheck(AvailabilityStatus status, Booking conflictingBooking) {

    public static SlotCheck of(AvailabilityStatus status) {
        return new SlotCheck(status, null);
    }

    public static SlotCheck conflict(Booking booking) {
        return new SlotCheck(AvailabilityStatus.CONFLICT, booking);
    }

    public boolean isAvailable() {
        return status == AvailabilityStatus.AVAILABLE;
    }
}
