package personal.agenda.scheduling.availability.domain.service;

import org.springframework.stereotype.Component;
import personal.agenda.scheduling.availability.domain.model.WorkingDay;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;
import personal.agenda.scheduling.staff.domain.model.DaySchedule;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Schedule Resolver (Domain Service)
 * 주간 근무표에서 특정 날짜의 근무 구간을 결정
 *
 * 해당 요일 항목이 없거나, 근무일이 아니거나, 시작/종료 시간이 유효하지 않으면 empty.
 * 휴게 시간은 시작이 종료보다 앞설 때만 인정한다.
 */
@Component
public class ScheduleResolver {

    public Optional<WorkingDay> resolve(WorkSchedule schedule, LocalDate date) {
        return schedule.forDay(date.getDayOfWeek())
                .filter(DaySchedule::hasWorkingHours)
                .map(this::toWorkingDay);
    }

    private WorkingDay toWorkingDay(DaySchedule day) {
        TimeWindow workingHours = new TimeWindow(day.startTime(), day.endTime());
        TimeWindow breakTime = day.hasBreak() ? new TimeWindow(day.breakStart(), day.breakEnd()) : null;
        return new WorkingDay(workingHours, breakTime);
    }
}
