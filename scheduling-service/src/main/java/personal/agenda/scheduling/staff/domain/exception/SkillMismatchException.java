package personal.agenda.scheduling.staff.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * Skill Mismatch Exception
 * 직원이 해당 서비스를 수행할 수 없을 때 발생
 */
public class SkillMismatchException extends BusinessException {
    public SkillMismatchException(Long staffId, Long serviceId) {
        super(ErrorCode.STAFF_SKILL_MISMATCH,
                String.format("Staff cannot perform service: staffId=%d, serviceId=%d", staffId, serviceId));
    }
}
