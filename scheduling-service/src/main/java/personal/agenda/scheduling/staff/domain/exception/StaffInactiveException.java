package personal.agenda.scheduling.staff.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * Staff Inactive Exception
 * 비활성화된 직원에게 예약/조회를 시도할 때 발생
 */
public class StaffInactiveException extends BusinessException {
    public StaffInactiveException(Long staffId) {
        super(ErrorCode.STAFF_INACTIVE,
                String.format("Staff is not active: staffId=%d", staffId));
    }
}
