package personal.agenda.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import personal.agenda.scheduling.booking.application.port.in.GetBookingsUseCase;
import personal.agenda.scheduling.booking.application.port.out.BookingRepository;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;
import personal.agenda.scheduling.catalog.application.port.out.TenantDirectory;
import personal.agenda.scheduling.catalog.domain.exception.TenantNotFoundException;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Booking Query Service
 */
@Service
@RequiredArgsConstructor
public class BookingQueryService implements GetBookingsUseCase {

    private static final Comparator<Booking> SCHEDULE_ORDER = Comparator
            .comparing(Booking::date)
            .thenComparing(Booking::startTime);

    private final BookingRepository bookingRepository;
    private final TenantDirectory tenantDirectory;

    @Override
    public List<Booking> getBookings(String tenantId, LocalDate date, BookingStatus status) {
        if (!tenantDirectory.exists(tenantId)) {
            throw new TenantNotFoundException(tenantId);
        }

        List<Booking> bookings = date != null
                ? bookingRepository.findByTenantAndDate(tenantId, date)
                : bookingRepository.findByTenant(tenantId);

        return bookings.stream()
                .filter(booking -> status == null || booking.status() == status)
                .sorted(SCHEDULE_ORDER)
                .toList();
    }
}
