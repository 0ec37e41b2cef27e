package personal.agenda.scheduling.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.agenda.scheduling.support.SchedulingFixtures.*;

@DisplayName("ConflictChecker 단위 테스트")
class ConflictCheckerTest {

    @ParameterizedTest(name = "[{0}, {1}) vs [{2}, {3}) -> {4}")
    @CsvSource({
            "10:00, 11:00, 11:00, 12:00, false",
            "11:00, 12:00, 10:00, 11:00, false",
            "10:00, 11:00, 10:30, 11:30, true",
            "10:30, 11:30, 10:00, 11:00, true",
            "10:00, 12:00, 10:30, 11:00, true",
            "10:30, 11:00, 10:00, 12:00, true",
            "10:00, 11:00, 10:00, 11:00, true",
            "09:00, 09:30, 14:00, 14:30, false"
    })
    @DisplayName("반개구간 겹침 판정 - 맞닿은 구간은 겹치지 않는다")
    void overlaps(String cs, String ce, String es, String ee, boolean expected) {
        assertThat(ConflictChecker.overlaps(time(cs), time(ce), time(es), time(ee))).isEqualTo(expected);
    }

    @Test
    @DisplayName("겹침 판정은 대칭이다")
    void overlapsIsSymmetric() {
        TimeWindow a = new TimeWindow(time("10:00"), time("10:45"));
        TimeWindow b = new TimeWindow(time("10:30"), time("11:15"));

        assertThat(a.overlaps(b)).isEqualTo(b.overlaps(a)).isTrue();
    }

    @Test
    @DisplayName("취소된 예약은 충돌로 보지 않는다")
    void cancelledBookingIsIgnored() {
        // given
        Booking cancelled = booking(1L, STAFF_ID, MONDAY, "10:00", "10:30", BookingStatus.CANCELLED);
        TimeWindow candidate = new TimeWindow(time("10:00"), time("10:30"));

        // when & then
        assertThat(ConflictChecker.findFirstConflict(candidate, List.of(cancelled))).isEmpty();
    }

    @Test
    @DisplayName("완료된 예약은 시간을 계속 점유한다")
    void completedBookingStillOccupies() {
        // given
        Booking completed = booking(1L, STAFF_ID, MONDAY, "10:00", "10:30", BookingStatus.COMPLETED);
        TimeWindow candidate = new TimeWindow(time("10:15"), time("10:45"));

        // when & then
        assertThat(ConflictChecker.findFirstConflict(candidate, List.of(completed))).contains(completed);
    }

    @Test
    @DisplayName("여러 예약 중 첫 번째 충돌 예약을 반환한다")
    void returnsFirstConflict() {
        // given
        Booking early = confirmedBooking(1L, "09:00", "09:30");
        Booking overlapping = confirmedBooking(2L, "10:00", "10:30");
        Booking alsoOverlapping = confirmedBooking(3L, "10:30", "11:00");
        TimeWindow candidate = new TimeWindow(time("10:15"), time("10:45"));

        // when & then
        assertThat(ConflictChecker.findFirstConflict(candidate, List.of(early, overlapping, alsoOverlapping)))
                .contains(overlapping);
        assertThat(ConflictChecker.hasConflict(new TimeWindow(time("09:30"), time("10:00")),
                List.of(early, overlapping))).isFalse();
    }
}
