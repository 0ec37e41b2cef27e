package personal.agenda.scheduling.booking.application.port.in;

import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

/**
 * Change Booking Status UseCase (Input Port)
 *
 * 허용 전이: PENDING → CONFIRMED, PENDING/CONFIRMED → CANCELLED, CONFIRMED → COMPLETED.
 * 다른 테넌트의 예약은 NOT_FOUND로 처리한다.
 */
public interface ChangeBookingStatusUseCase {

    SchedulingResult<Booking> confirm(String tenantId, Long bookingId);

    SchedulingResult<Booking> cancel(String tenantId, Long bookingId);

    SchedulingResult<Booking> complete(String tenantId, Long bookingId);
}
