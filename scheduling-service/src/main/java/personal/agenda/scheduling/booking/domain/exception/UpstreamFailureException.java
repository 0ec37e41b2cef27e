package personal.agenda.scheduling.booking.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * 저장소 조회가 모두 실패했을 때 발생
 */
public class UpstreamFailureException extends BusinessException {
    public UpstreamFailureException(String detail, Throwable cause) {
        super(ErrorCode.UPSTREAM_FAILURE, detail, cause);
    }
}
