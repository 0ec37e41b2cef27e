package personal.agenda.scheduling.availability.adapter.in.web.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 가능 시작 시각 응답 DTO (HH:mm)
 */
public record TimeSlotsResponse(
        Long staffId,
        LocalDate date,
        int durationMinutes,
        List<String> slots
) {
}
