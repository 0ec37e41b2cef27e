package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

public record AvailabilityCheckQuery(
        Long staffId,
        LocalDate date,
        LocalTime startTime,
        int durationMinutes
) {
    public AvailabilityCheckQuery {
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
        if (date == null || startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date and start time cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration must be positive: " + durationMinutes);
        }
    }
}
