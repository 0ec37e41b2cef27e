package personal.agenda.scheduling.availability.application.port.in;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Time Slot Query
 * 직원의 특정 날짜 예약 가능 시작 시각 조회 조건
 */
public record TimeSlotQuery(
        Long staffId,
        LocalDate date,
        int durationMinutes
) {
    public TimeSlotQuery {
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration must be positive: " + durationMinutes);
        }
    }
}
