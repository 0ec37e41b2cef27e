package personal.agenda.scheduling.booking.adapter.out.persistence;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.agenda.scheduling.booking.application.port.out.BookingRepository;
import personal.agenda.scheduling.booking.domain.exception.BookingNotFoundException;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 *
 * 조회는 일시적 저장소 오류에 대해 재시도(storeRead), 쓰기는 재시도하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: tenantId={}, staffId={}, date={}, startTime={}",
                booking.tenantId(), booking.staffId(), booking.date(), booking.startTime());
        return jpaBookingRepository.save(BookingEntity.fromDomain(booking)).toDomain();
    }

    @Override
    @Retry(name = "storeRead")
    public Optional<Booking> findById(Long bookingId) {
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    @Retry(name = "storeRead")
    public List<Booking> findByTenantAndDate(String tenantId, LocalDate date) {
        return jpaBookingRepository.findAllByTenantIdAndBookingDateOrderByStartTimeAsc(tenantId, date).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    @Retry(name = "storeRead")
    public List<Booking> findByStaffAndDate(Long staffId, LocalDate date) {
        return jpaBookingRepository.findAllByStaffIdAndBookingDateOrderByStartTimeAsc(staffId, date).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    @Retry(name = "storeRead")
    public List<Booking> findByTenant(String tenantId) {
        return jpaBookingRepository.findAllByTenantIdOrderByBookingDateAscStartTimeAsc(tenantId).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public Booking updateStatus(Long bookingId, BookingStatus status) {
        BookingEntity entity = jpaBookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        entity.updateStatus(status);
        log.debug("Booking status updated: bookingId={}, status={}", bookingId, status);
        return jpaBookingRepository.saveAndFlush(entity).toDomain();
    }
}
