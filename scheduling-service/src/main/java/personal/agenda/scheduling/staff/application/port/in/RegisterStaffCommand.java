package personal.agenda.scheduling.staff.application.port.in;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

/**
 * Register Staff Command
 * 직원 등록 커맨드
 */
public record RegisterStaffCommand(
        String tenantId,
        String name,
        String email,
        String position,
        WorkSchedule workSchedule
) {
    public RegisterStaffCommand {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff name cannot be blank");
        }
    }
}
