package personal.agenda.scheduling.availability.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.agenda.scheduling.availability.domain.model.WorkingDay;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;
import personal.agenda.scheduling.staff.domain.model.DaySchedule;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.agenda.scheduling.support.SchedulingFixtures.*;

@DisplayName("ScheduleResolver 단위 테스트")
class ScheduleResolverTest {

    private final ScheduleResolver scheduleResolver = new ScheduleResolver();

    @Test
    @DisplayName("근무일이면 근무 구간과 휴게 구간을 반환한다")
    void resolveWorkingDay() {
        // when
        Optional<WorkingDay> day = scheduleResolver.resolve(weekdaySchedule(), MONDAY);

        // then
        assertThat(day).isPresent();
        assertThat(day.get().workingHours()).isEqualTo(new TimeWindow(time("09:00"), time("17:00")));
        assertThat(day.get().breakWindow()).contains(new TimeWindow(time("12:00"), time("13:00")));
    }

    @Test
    @DisplayName("근무표에 해당 요일이 없으면 empty")
    void missingDay() {
        assertThat(scheduleResolver.resolve(weekdaySchedule(), SUNDAY)).isEmpty();
    }

    @Test
    @DisplayName("근무 플래그가 꺼져 있으면 empty")
    void dayOff() {
        WorkSchedule schedule = new WorkSchedule(Map.of(DayOfWeek.MONDAY, DaySchedule.off()));

        assertThat(scheduleResolver.resolve(schedule, MONDAY)).isEmpty();
    }

    @Test
    @DisplayName("시작 시간이 종료 시간보다 늦으면 empty")
    void invalidWorkingHours() {
        WorkSchedule schedule = new WorkSchedule(Map.of(DayOfWeek.MONDAY,
                new DaySchedule(true, time("18:00"), time("09:00"), null, null)));

        assertThat(scheduleResolver.resolve(schedule, MONDAY)).isEmpty();
    }

    @Test
    @DisplayName("휴게 시간이 유효하지 않으면 휴게 없이 근무 구간만 반환한다")
    void invalidBreakIsIgnored() {
        WorkSchedule schedule = new WorkSchedule(Map.of(DayOfWeek.MONDAY,
                DaySchedule.withBreak(time("09:00"), time("17:00"), time("13:00"), time("12:00"))));

        Optional<WorkingDay> day = scheduleResolver.resolve(schedule, MONDAY);

        assertThat(day).isPresent();
        assertThat(day.get().breakWindow()).isEmpty();
    }

    @Test
    @DisplayName("빈 근무표는 모든 날짜가 비근무일이다")
    void emptySchedule() {
        assertThat(scheduleResolver.resolve(WorkSchedule.empty(), MONDAY)).isEmpty();
    }
}
