package personal.agenda.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    List<BookingEntity> findAllByTenantIdAndBookingDateOrderByStartTimeAsc(String tenantId, LocalDate bookingDate);

    List<BookingEntity> findAllByStaffIdAndBookingDateOrderByStartTimeAsc(Long staffId, LocalDate bookingDate);

    List<BookingEntity> findAllByTenantIdOrderByBookingDateAscStartTimeAsc(String tenantId);
}
