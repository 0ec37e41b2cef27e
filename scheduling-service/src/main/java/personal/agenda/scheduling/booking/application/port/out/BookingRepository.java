package personal.agenda.scheduling.booking.application.port.out;

import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Booking Repository Port (Output Port)
 * 조회 결과는 상태와 무관하게 반환하며, 점유 판단은 도메인에서 한다
 */
public interface BookingRepository {

    Booking save(Booking booking);

    Optional<Booking> findById(Long bookingId);

    List<Booking> findByTenantAndDate(String tenantId, LocalDate date);

    List<Booking> findByStaffAndDate(Long staffId, LocalDate date);

    List<Booking> findByTenant(String tenantId);

    /**
     * 상태만 변경 (시간/가격 등 다른 값은 변경하지 않음)
     */
    Booking updateStatus(Long bookingId, BookingStatus status);
}
