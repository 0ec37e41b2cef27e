package personal.agenda.scheduling.availability.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.agenda.scheduling.availability.application.port.in.AvailabilityCheckQuery;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특정 시각 가용 여부 확인 요청 DTO
 */
public record AvailabilityCheckRequest(
        @NotNull(message = "직원 ID는 필수입니다.")
        Long staffId,

        @NotNull(message = "날짜는 필수입니다.")
        LocalDate date,

        @NotNull(message = "시작 시간은 필수입니다.")
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,

        @NotNull(message = "소요 시간은 필수입니다.")
        @Min(value = 1, message = "소요 시간은 1분 이상이어야 합니다.")
        @Max(value = 1440, message = "소요 시간은 하루를 넘을 수 없습니다.")
        Integer durationMinutes
) {
    public AvailabilityCheckQuery toQuery() {
        return new AvailabilityCheckQuery(staffId, date, startTime, durationMinutes);
    }
}
