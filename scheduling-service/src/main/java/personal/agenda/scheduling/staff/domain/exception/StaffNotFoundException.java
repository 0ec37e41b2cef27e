package personal.agenda.scheduling.staff.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * Staff Not Found Exception
 * 직원을 찾을 수 없거나 다른 테넌트 소속일 때 발생하는 예외
 */
public class StaffNotFoundException extends BusinessException {
    public StaffNotFoundException(Long staffId) {
        super(ErrorCode.STAFF_NOT_FOUND,
                String.format("Staff not found: staffId=%d", staffId));
    }
}
