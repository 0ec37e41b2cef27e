package personal.agenda.scheduling.staff.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

public class SkillAlreadyAssignedException extends BusinessException {
    public SkillAlreadyAssignedException(Long staffId, Long serviceId) {
        super(ErrorCode.SKILL_ALREADY_ASSIGNED,
                String.format("Skill already assigned: staffId=%d, serviceId=%d", staffId, serviceId));
    }
}
