package personal.agenda.scheduling.booking.application.port.in;

import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Bookings UseCase (Input Port)
 */
public interface GetBookingsUseCase {

    /**
     * 테넌트 예약 목록 (날짜, 시작 시각 순)
     *
     * @param date   null이면 전체 날짜
     * @param status null이면 전체 상태
     * @throws personal.agenda.scheduling.catalog.domain.exception.TenantNotFoundException 테넌트가 없을 때
     */
    List<Booking> getBookings(String tenantId, LocalDate date, BookingStatus status);
}
