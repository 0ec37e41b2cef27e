package personal.agenda.scheduling.booking.domain.service;

import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Conflict Checker
 * 반개구간 [start, end) 겹침 판정 유틸리티
 *
 * 끝과 시작이 맞닿은 구간(10:00-11:00, 11:00-12:00)은 겹치지 않는다.
 */
public final class ConflictChecker {

    private ConflictChecker() {
        // Utility class
    }

    public static boolean overlaps(LocalTime candidateStart, LocalTime candidateEnd,
                                   LocalTime existingStart, LocalTime existingEnd) {
        return candidateStart.isBefore(existingEnd) && candidateEnd.isAfter(existingStart);
    }

    /**
     * 후보 구간과 겹치는 첫 번째 예약 조회
     * 취소된 예약은 무시하고, 완료된 예약은 점유로 본다
     */
    public static Optional<Booking> findFirstConflict(TimeWindow candidate, List<Booking> bookings) {
        return bookings.stream()
                .filter(Booking::occupiesTime)
                .filter(booking -> candidate.overlaps(booking.window()))
                .findFirst();
    }

    public static boolean hasConflict(TimeWindow candidate, List<Booking> bookings) {
        return findFirstConflict(candidate, bookings).isPresent();
    }
}
