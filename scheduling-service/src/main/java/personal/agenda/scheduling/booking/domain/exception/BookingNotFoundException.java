package personal.agenda.scheduling.booking.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 * 예약이 없거나 다른 테넌트의 예약일 때 발생하는 예외
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(Long bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND,
                String.format("Booking not found: bookingId=%d", bookingId));
    }
}
