package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.scheduling.availability.domain.model.AvailableStaff;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

import java.util.List;

/**
 * Find Available Staff UseCase (Input Port)
 */
public interface FindAvailableStaffUseCase {

    /**
     * 서비스를 수행할 수 있고 요청 시각에 비어 있는 직원 목록
     *
     * 개별 직원 조회 실패는 해당 직원만 제외한다.
     * 후보 전원이 조회에 실패하면 UPSTREAM_FAILURE.
     */
    SchedulingResult<List<AvailableStaff>> listAvailableStaffForService(AvailableStaffQuery query);
}
