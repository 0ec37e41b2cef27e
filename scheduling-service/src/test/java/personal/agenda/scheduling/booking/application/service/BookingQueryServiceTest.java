package personal.agenda.scheduling.booking.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.agenda.scheduling.booking.application.port.out.BookingRepository;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;
import personal.agenda.scheduling.catalog.application.port.out.TenantDirectory;
import personal.agenda.scheduling.catalog.domain.exception.TenantNotFoundException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static personal.agenda.scheduling.support.SchedulingFixtures.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingQueryService 테스트")
class BookingQueryServiceTest {

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private TenantDirectory tenantDirectory;

    @InjectMocks
    private BookingQueryService bookingQueryService;

    @Test
    @DisplayName("날짜 없이 조회하면 전체 예약을 날짜, 시작 시각 순으로 반환한다")
    void getAll_SortedBySchedule() {
        // given
        given(tenantDirectory.exists(TENANT_ID)).willReturn(true);
        given(bookingRepository.findByTenant(TENANT_ID)).willReturn(List.of(
                booking(3L, STAFF_ID, MONDAY.plusDays(1), "09:00", "09:30", BookingStatus.PENDING),
                booking(2L, STAFF_ID, MONDAY, "14:00", "14:30", BookingStatus.CONFIRMED),
                booking(1L, STAFF_ID, MONDAY, "10:00", "10:30", BookingStatus.CANCELLED)));

        // when
        List<Booking> bookings = bookingQueryService.getBookings(TENANT_ID, null, null);

        // then
        assertThat(bookings).extracting(Booking::id).containsExactly(1L, 2L, 3L);
    }

    @Test
    @DisplayName("날짜와 상태로 필터링한다")
    void getByDateAndStatus() {
        given(tenantDirectory.exists(TENANT_ID)).willReturn(true);
        given(bookingRepository.findByTenantAndDate(TENANT_ID, MONDAY)).willReturn(List.of(
                booking(1L, STAFF_ID, MONDAY, "10:00", "10:30", BookingStatus.CANCELLED),
                booking(2L, STAFF_ID, MONDAY, "14:00", "14:30", BookingStatus.CONFIRMED)));

        List<Booking> bookings = bookingQueryService.getBookings(TENANT_ID, MONDAY, BookingStatus.CONFIRMED);

        assertThat(bookings).extracting(Booking::id).containsExactly(2L);
    }

    @Test
    @DisplayName("없는 테넌트는 TenantNotFoundException")
    void tenantNotFound() {
        given(tenantDirectory.exists("unknown")).willReturn(false);

        assertThatThrownBy(() -> bookingQueryService.getBookings("unknown", MONDAY, null))
                .isInstanceOf(TenantNotFoundException.class);
        verifyNoInteractions(bookingRepository);
    }
}
