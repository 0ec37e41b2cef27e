package personal.agenda.scheduling.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 예약 조회/생성 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        String tenantId,
        Long serviceId,
        String serviceName,
        BigDecimal servicePrice,
        Long staffId,
        String staffName,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,
        int durationMinutes,
        BookingStatus status,
        String clientName,
        String clientPhone,
        String clientEmail,
        String notes,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.tenantId(),
                booking.serviceId(),
                booking.serviceName(),
                booking.servicePrice(),
                booking.staffId(),
                booking.staffName(),
                booking.date(),
                booking.startTime(),
                booking.endTime(),
                booking.actualDuration(),
                booking.status(),
                booking.client().name(),
                booking.client().phone(),
                booking.client().email(),
                booking.notes(),
                booking.createdAt()
        );
    }
}
