package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

import java.util.List;

/**
 * Generate Time Slots UseCase (Input Port)
 */
public interface GenerateTimeSlotsUseCase {

    /**
     * 예약 가능한 시작 시각 목록 (HH:mm, 오름차순)
     * 근무일이 아니면 빈 목록으로 성공한다
     *
     * 실패: NOT_FOUND(직원 없음), INACTIVE_RESOURCE(비활성 직원), UPSTREAM_FAILURE
     */
    SchedulingResult<List<String>> generateTimeSlots(TimeSlotQuery query);
}
