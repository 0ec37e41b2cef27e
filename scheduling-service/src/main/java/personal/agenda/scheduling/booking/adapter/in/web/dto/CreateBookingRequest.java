package personal.agenda.scheduling.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.agenda.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.agenda.scheduling.booking.domain.model.ClientInfo;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 예약 생성 요청 DTO
 * staffId를 생략하면 직원 미지정 예약
 */
public record CreateBookingRequest(
        @NotNull(message = "서비스 ID는 필수입니다.")
        Long serviceId,

        Long staffId,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate date,

        @NotNull(message = "시작 시간은 필수입니다.")
        @JsonFormat(pattern = "HH:mm")
        LocalTime startTime,

        @NotBlank(message = "고객 이름은 필수입니다.")
        String clientName,

        @NotBlank(message = "고객 연락처는 필수입니다.")
        String clientPhone,

        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String clientEmail,

        @Size(max = 1000, message = "메모는 1000자 이하여야 합니다.")
        String notes
) {
    public CreateBookingCommand toCommand(String tenantId) {
        return new CreateBookingCommand(tenantId, serviceId, staffId, date, startTime,
                new ClientInfo(clientName, clientPhone, clientEmail), notes);
    }
}
