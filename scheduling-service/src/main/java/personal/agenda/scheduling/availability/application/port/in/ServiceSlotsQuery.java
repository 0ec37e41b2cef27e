package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

import java.time.LocalDate;

public record ServiceSlotsQuery(
        String tenantId,
        Long staffId,
        Long serviceId,
        LocalDate date
) {
    public ServiceSlotsQuery {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (staffId == null || serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID and service ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
    }
}
