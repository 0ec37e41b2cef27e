package personal.agenda.scheduling.availability.domain.service;

import org.springframework.stereotype.Component;
import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.availability.domain.model.AvailabilityStatus;
import personal.agenda.scheduling.availability.domain.model.SlotCheck;
import personal.agenda.scheduling.availability.domain.model.WorkingDay;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;
import personal.agenda.scheduling.booking.domain.service.ConflictChecker;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Slot Generator (Domain Service)
 * 근무 구간 안에서 15분 간격으로 예약 가능한 시작 시각을 생성
 *
 * 후보 [t, t+duration)은 근무 구간 안에 있어야 하고,
 * 휴게 구간 및 취소되지 않은 예약과 겹치지 않아야 한다.
 */
@Component
public class SlotGenerator {

    public static final int SLOT_GRANULARITY_MINUTES = 15;
    private static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * @param day             해당 날짜의 근무 구간
     * @param durationMinutes 소요 시간(분)
     * @param bookings        해당 직원/날짜의 예약 (상태 무관, 취소 건은 내부에서 제외)
     * @return 오름차순 시작 시각 목록
     */
    public List<LocalTime> generate(WorkingDay day, int durationMinutes, List<Booking> bookings) {
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration must be positive: " + durationMinutes);
        }

        List<LocalTime> slots = new ArrayList<>();
        int workEnd = TimeWindow.minuteOfDay(day.workingHours().end());
        int cursor = TimeWindow.minuteOfDay(day.workingHours().start());

        while (durationMinutes <= workEnd - cursor) {
            LocalTime start = LocalTime.of(cursor / 60, cursor % 60);
            TimeWindow candidate = new TimeWindow(start, start.plusMinutes(durationMinutes));
            if (check(day, candidate, bookings).isAvailable()) {
                slots.add(start);
            }
            cursor += SLOT_GRANULARITY_MINUTES;
        }
        return slots;
    }

    /**
     * 단일 후보 구간 평가
     * 판정 순서: 근무 시간 밖 → 휴게 시간 → 예약 충돌
     */
    public SlotCheck check(WorkingDay day, TimeWindow candidate, List<Booking> bookings) {
        if (!day.workingHours().contains(candidate)) {
            return SlotCheck.of(AvailabilityStatus.OUTSIDE_WORKING_HOURS);
        }
        if (day.breakWindow().filter(candidate::overlaps).isPresent()) {
            return SlotCheck.of(AvailabilityStatus.DURING_BREAK);
        }
        Optional<Booking> conflict = ConflictChecker.findFirstConflict(candidate, bookings);
        return conflict.map(SlotCheck::conflict)
                .orElseGet(() -> SlotCheck.of(AvailabilityStatus.AVAILABLE));
    }

    /**
     * 요청 시각과 가까운 순서로 최대 limit개 선택 (같은 거리면 이른 시각 우선)
     */
    public List<LocalTime> nearest(List<LocalTime> slots, LocalTime target, int limit) {
        int targetMinute = TimeWindow.minuteOfDay(target);
        return slots.stream()
                .sorted(Comparator.<LocalTime>comparingInt(
                                slot -> Math.abs(TimeWindow.minuteOfDay(slot) - targetMinute))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(limit)
                .toList();
    }

    public static List<String> format(List<LocalTime> slots) {
        return slots.stream()
                .map(SLOT_FORMAT::format)
                .toList();
    }

    public static List<LocalTime> parse(List<String> slots) {
        return slots.stream()
                .map(slot -> LocalTime.parse(slot, SLOT_FORMAT))
                .toList();
    }
}
