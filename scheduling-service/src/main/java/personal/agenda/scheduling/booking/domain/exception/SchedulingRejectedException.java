package personal.agenda.scheduling.booking.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.scheduling.booking.domain.model.SchedulingFailure;

/**
 * 실패한 SchedulingResult를 예외로 전환할 때 사용
 * ErrorCode와 상세 메시지는 원래 실패 정보를 그대로 따른다
 */
public class SchedulingRejectedException extends BusinessException {

    private final transient SchedulingFailure failure;

    public SchedulingRejectedException(SchedulingFailure failure) {
        super(failure.errorCode(), failure.detail());
        this.failure = failure;
    }

    public SchedulingFailure getFailure() {
        return failure;
    }
}
