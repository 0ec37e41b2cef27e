package personal.agenda.scheduling.availability.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import personal.agenda.scheduling.availability.domain.model.AvailabilityStatus;
import personal.agenda.scheduling.availability.domain.model.StaffAvailability;
import personal.agenda.scheduling.booking.adapter.in.web.dto.BookingResponse;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 특정 시각 가용 여부 응답 DTO
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailabilityCheckResponse(
        Long staffId,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,
        int durationMinutes,
        boolean available,
        AvailabilityStatus reason,
        BookingResponse conflictingBooking,
        List<String> suggestedTimes
) {
    public static AvailabilityCheckResponse from(StaffAvailability availability) {
        return new AvailabilityCheckResponse(
                availability.staffId(),
                availability.date(),
                availability.startTime(),
                availability.durationMinutes(),
                availability.available(),
                availability.status(),
                availability.conflictingBooking() != null
                        ? BookingResponse.from(availability.conflictingBooking())
                        : null,
                availability.suggestedTimes()
        );
    }
}
