package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Available Staff Query
 *
 * @param durationMinutes 요청 소요 시간, null이면 서비스 기본 시간
 */
public record AvailableStaffQuery(
        String tenantId,
        Long serviceId,
        LocalDate date,
        LocalTime startTime,
        Integer durationMinutes
) {
    public AvailableStaffQuery {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (date == null || startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date and start time cannot be null");
        }
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration must be positive: " + durationMinutes);
        }
    }
}
