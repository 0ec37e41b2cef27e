package personal.agenda.scheduling.availability.adapter.in.web.dto;

import personal.agenda.scheduling.availability.domain.model.StaffServiceSlots;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 직원-서비스 예약 가능 시각 응답 DTO
 */
public record ServiceSlotsResponse(
        Long staffId,
        String staffName,
        Long serviceId,
        String serviceName,
        LocalDate date,
        BigDecimal price,
        int durationMinutes,
        List<String> slots
) {
    public static ServiceSlotsResponse from(StaffServiceSlots serviceSlots) {
        return new ServiceSlotsResponse(
                serviceSlots.staffId(),
                serviceSlots.staffName(),
                serviceSlots.serviceId(),
                serviceSlots.serviceName(),
                serviceSlots.date(),
                serviceSlots.price(),
                serviceSlots.durationMinutes(),
                serviceSlots.slots()
        );
    }
}
