package personal.agenda.scheduling.booking.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;

/**
 * Invalid Booking Transition Exception
 * 허용되지 않는 예약 상태 변경
 */
public class InvalidBookingTransitionException extends BusinessException {
    public InvalidBookingTransitionException(Long bookingId, BookingStatus currentStatus, BookingStatus targetStatus) {
        super(ErrorCode.INVALID_BOOKING_TRANSITION,
                String.format("Cannot change booking status: bookingId=%d, current=%s, target=%s",
                        bookingId, currentStatus, targetStatus));
    }
}
