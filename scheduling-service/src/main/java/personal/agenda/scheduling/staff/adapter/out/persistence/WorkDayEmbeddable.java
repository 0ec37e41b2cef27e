package personal.agenda.scheduling.staff.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.agenda.scheduling.staff.domain.model.DaySchedule;

import java.time.LocalTime;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkDayEmbeddable {

    @Column(name = "working", nullable = false)
    private boolean working;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Column(name = "break_start")
    private LocalTime breakStart;

    @Column(name = "break_end")
    private LocalTime breakEnd;

    public static WorkDayEmbeddable fromDomain(DaySchedule day) {
        WorkDayEmbeddable embeddable = new WorkDayEmbeddable();
        embeddable.working = day.working();
        embeddable.startTime = day.startTime();
        embeddable.endTime = day.endTime();
        embeddable.breakStart = day.breakStart();
        embeddable.breakEnd = day.breakEnd();
        return embeddable;
    }

    public DaySchedule toDomain() {
        return new DaySchedule(working, startTime, endTime, breakStart, breakEnd);
    }
}
