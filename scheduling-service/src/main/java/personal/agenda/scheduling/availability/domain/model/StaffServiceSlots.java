package personal.agenda.scheduling.availability.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 직원-서비스 조합의 당일 예약 가능 시작 시각
 */
public record StaffServiceSlots(
        Long staffId,
        String staffName,
        Long serviceId,
        String serviceName,
        LocalDate date,
        BigDecimal price,
        int durationMinutes,
        List<String> slots) {
}
