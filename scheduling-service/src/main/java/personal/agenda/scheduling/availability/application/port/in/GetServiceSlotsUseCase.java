package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.scheduling.availability.domain.model.StaffServiceSlots;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

/**
 * Get Service Slots UseCase (Input Port)
 * 직원-서비스 조합 기준 예약 가능 시각 (직원별 소요 시간 반영)
 */
public interface GetServiceSlotsUseCase {

    SchedulingResult<StaffServiceSlots> getServiceSlots(ServiceSlotsQuery query);
}
