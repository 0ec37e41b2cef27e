package personal.agenda.scheduling.booking.application.port.in;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.model.ClientInfo;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Create Booking Command
 * 예약 생성 커맨드
 *
 * @param staffId 담당 직원, null이면 직원 미지정 예약
 */
public record CreateBookingCommand(
        String tenantId,
        Long serviceId,
        Long staffId,
        LocalDate date,
        LocalTime startTime,
        ClientInfo client,
        String notes
) {
    public CreateBookingCommand {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (client == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Client info cannot be null");
        }
    }

    public boolean hasStaff() {
        return staffId != null;
    }
}
