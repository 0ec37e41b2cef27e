package personal.agenda.scheduling.booking.application.port.in;

import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

/**
 * Create Booking UseCase (Input Port)
 * 예약 생성 유스케이스
 */
public interface CreateBookingUseCase {

    /**
     * 예약 생성
     * 모든 검증을 통과한 경우에만 PENDING 상태로 저장한다
     *
     * @param command 예약 커맨드
     * @return 저장된 예약 또는 실패 사유
     *         (NOT_FOUND, INACTIVE_RESOURCE, CAPABILITY_MISMATCH,
     *         SCHEDULE_UNAVAILABLE, SCHEDULING_CONFLICT, UPSTREAM_FAILURE)
     */
    SchedulingResult<Booking> createBooking(CreateBookingCommand command);
}
