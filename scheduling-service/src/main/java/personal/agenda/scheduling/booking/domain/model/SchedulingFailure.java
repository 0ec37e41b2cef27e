package personal.agenda.scheduling.booking.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.exception.SchedulingConflictException;
import personal.agenda.scheduling.booking.domain.exception.SchedulingRejectedException;

/**
 * 스케줄링 실패 정보
 *
 * @param reason             실패 사유 분류
 * @param errorCode          응답 코드 결정용 ErrorCode
 * @param detail             상세 원인
 * @param conflictingBooking 충돌한 예약 (SCHEDULING_CONFLICT인 경우에만)
 */
public record SchedulingFailure(
        FailureReason reason,
        ErrorCode errorCode,
        String detail,
        Booking conflictingBooking) {

    public static SchedulingFailure of(FailureReason reason, BusinessException e) {
        Booking conflicting = e instanceof SchedulingConflictException conflict
                ? conflict.getConflictingBooking()
                : null;
        return new SchedulingFailure(reason, e.getErrorCode(), e.getMessage(), conflicting);
    }

    public static SchedulingFailure upstream(Throwable cause) {
        return new SchedulingFailure(FailureReason.UPSTREAM_FAILURE, ErrorCode.UPSTREAM_FAILURE,
                "Store operation failed: " + cause.getMessage(), null);
    }

    public SchedulingRejectedException toException() {
        return new SchedulingRejectedException(this);
    }
}
