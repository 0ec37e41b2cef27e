package personal.agenda.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;
import personal.agenda.scheduling.booking.application.port.in.ChangeBookingStatusUseCase;
import personal.agenda.scheduling.booking.application.port.out.BookingRepository;
import personal.agenda.scheduling.booking.domain.exception.BookingNotFoundException;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

import java.util.function.UnaryOperator;

/**
 * Booking Status Service
 * 예약 상태 전이 (확정/취소/완료)
 *
 * 전이 규칙은 Booking 도메인 모델이 검증한다.
 * 상태가 바뀌면 해당 직원/날짜의 슬롯 캐시를 무효화한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStatusService implements ChangeBookingStatusUseCase {

    private final BookingRepository bookingRepository;
    private final AvailabilityCacheRepository availabilityCache;

    @Override
    public SchedulingResult<Booking> confirm(String tenantId, Long bookingId) {
        return transition("confirmBooking", tenantId, bookingId, Booking::confirm);
    }

    @Override
    public SchedulingResult<Booking> cancel(String tenantId, Long bookingId) {
        return transition("cancelBooking", tenantId, bookingId, Booking::cancel);
    }

    @Override
    public SchedulingResult<Booking> complete(String tenantId, Long bookingId) {
        return transition("completeBooking", tenantId, bookingId, Booking::complete);
    }

    private SchedulingResult<Booking> transition(String operation, String tenantId, Long bookingId,
                                                 UnaryOperator<Booking> change) {
        return SchedulingOperations.capture(operation, () -> {
            Booking booking = bookingRepository.findById(bookingId)
                    .filter(found -> found.belongsTo(tenantId))
                    .orElseThrow(() -> new BookingNotFoundException(bookingId));

            Booking changed = change.apply(booking);
            Booking saved = bookingRepository.updateStatus(bookingId, changed.status());

            if (saved.isAssigned()) {
                availabilityCache.evictSlots(saved.tenantId(), saved.staffId(), saved.date());
            }
            log.info("Booking status changed: bookingId={}, from={}, to={}",
                    bookingId, booking.status(), saved.status());
            return saved;
        });
    }
}
