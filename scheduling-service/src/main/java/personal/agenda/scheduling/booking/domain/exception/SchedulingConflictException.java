package personal.agenda.scheduling.booking.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.model.Booking;

/**
 * Scheduling Conflict Exception
 * 요청 시간대가 기존 예약과 겹칠 때 발생 (충돌한 예약을 함께 전달)
 */
public class SchedulingConflictException extends BusinessException {

    private final transient Booking conflictingBooking;

    public SchedulingConflictException(Booking conflictingBooking) {
        super(ErrorCode.SCHEDULING_CONFLICT,
                String.format("Time slot conflicts with existing booking: bookingId=%d, start=%s, end=%s",
                        conflictingBooking.id(), conflictingBooking.startTime(), conflictingBooking.endTime()));
        this.conflictingBooking = conflictingBooking;
    }

    public Booking getConflictingBooking() {
        return conflictingBooking;
    }
}
