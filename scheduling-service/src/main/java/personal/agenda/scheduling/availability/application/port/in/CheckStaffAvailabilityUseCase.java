package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.scheduling.availability.domain.model.StaffAvailability;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

/**
 * Check Staff Availability UseCase (Input Port)
 */
public interface CheckStaffAvailabilityUseCase {

    /**
     * 요청 시각에 직원이 예약 가능한지 판정
     * 불가한 경우 사유와 가까운 대체 시작 시각(최대 3개)을 함께 반환
     */
    SchedulingResult<StaffAvailability> isStaffAvailableAt(AvailabilityCheckQuery query);
}
