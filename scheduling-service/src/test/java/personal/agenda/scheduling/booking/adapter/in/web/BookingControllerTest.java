package personal.agenda.scheduling.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.agenda.scheduling.booking.application.port.in.ChangeBookingStatusUseCase;
import personal.agenda.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.agenda.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.agenda.scheduling.booking.application.port.in.GetBookingsUseCase;
import personal.agenda.scheduling.booking.domain.exception.SchedulingConflictException;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;
import personal.agenda.scheduling.booking.domain.model.FailureReason;
import personal.agenda.scheduling.booking.domain.model.SchedulingFailure;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;
import personal.agenda.scheduling.catalog.domain.exception.TenantNotFoundException;
import personal.agenda.scheduling.staff.domain.exception.SkillMismatchException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;
import static personal.agenda.scheduling.support.SchedulingFixtures.*;

/**
 * Booking Controller 단위 테스트
 * @WebMvcTest로 요청 검증과 실패 응답 변환만 확인
 */
@WebMvcTest(BookingController.class)
@DisplayName("Booking API 단위 테스트")
class BookingControllerTest {

    private static final String BOOKINGS_URL = "/api/v1/tenants/salon-1/bookings";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreateBookingUseCase createBookingUseCase;
    @MockBean
    private ChangeBookingStatusUseCase changeBookingStatusUseCase;
    @MockBean
    private GetBookingsUseCase getBookingsUseCase;

    private static final String VALID_REQUEST = """
            {
              "serviceId": 10,
              "staffId": 1,
              "date": "2024-01-15",
              "startTime": "10:00",
              "clientName": "홍길동",
              "clientPhone": "010-1234-5678",
              "clientEmail": "hong@example.com"
            }
            """;

    @Test
    @DisplayName("예약 생성 성공 시 201과 예약 정보를 반환한다")
    void createBooking_Created() throws Exception {
        // given
        Booking created = booking(100L, STAFF_ID, MONDAY, "10:00", "10:30", BookingStatus.PENDING);
        given(createBookingUseCase.createBooking(any(CreateBookingCommand.class)))
                .willReturn(SchedulingResult.success(created));

        // when & then
        mockMvc.perform(post(BOOKINGS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_REQUEST))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bookingId").value(100))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.startTime").value("10:00"))
                .andExpect(jsonPath("$.endTime").value("10:30"))
                .andExpect(jsonPath("$.date").value("2024-01-15"));
    }

    @Test
    @DisplayName("시간 충돌 실패는 409와 오류 코드 B003으로 응답한다")
    void createBooking_Conflict() throws Exception {
        // given
        SchedulingFailure failure = SchedulingFailure.of(FailureReason.SCHEDULING_CONFLICT,
                new SchedulingConflictException(confirmedBooking(1L, "10:00", "10:30")));
        given(createBookingUseCase.createBooking(any(CreateBookingCommand.class)))
                .willReturn(SchedulingResult.failure(failure));

        // when & then
        mockMvc.perform(post(BOOKINGS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_REQUEST))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B003"))
                .andExpect(jsonPath("$.detail").exists());
    }

    @Test
    @DisplayName("스킬 불일치 실패는 400과 오류 코드 S003으로 응답한다")
    void createBooking_SkillMismatch() throws Exception {
        SchedulingFailure failure = SchedulingFailure.of(FailureReason.CAPABILITY_MISMATCH,
                new SkillMismatchException(STAFF_ID, 20L));
        given(createBookingUseCase.createBooking(any(CreateBookingCommand.class)))
                .willReturn(SchedulingResult.failure(failure));

        mockMvc.perform(post(BOOKINGS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("S003"));
    }

    @Test
    @DisplayName("필수 값이 없으면 400이며 유스케이스를 호출하지 않는다")
    void createBooking_InvalidRequest() throws Exception {
        String request = """
                {
                  "serviceId": 10,
                  "date": "2024-01-15",
                  "startTime": "10:00",
                  "clientPhone": "010-1234-5678"
                }
                """;

        mockMvc.perform(post(BOOKINGS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"))
                .andExpect(jsonPath("$.message").value("고객 이름은 필수입니다."));
        verify(createBookingUseCase, never()).createBooking(any());
    }

    @Test
    @DisplayName("시간 형식이 HH:mm이 아니면 400")
    void createBooking_InvalidTimeFormat() throws Exception {
        String request = VALID_REQUEST.replace("\"10:00\"", "\"10시\"");

        mockMvc.perform(post(BOOKINGS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("예약 목록은 날짜와 상태로 조회한다")
    void getBookings() throws Exception {
        given(getBookingsUseCase.getBookings(TENANT_ID, MONDAY, BookingStatus.CONFIRMED))
                .willReturn(List.of(confirmedBooking(1L, "09:00", "09:30"), confirmedBooking(2L, "11:00", "11:30")));

        mockMvc.perform(get(BOOKINGS_URL)
                        .param("date", "2024-01-15")
                        .param("status", "CONFIRMED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].startTime").value("09:00"));
    }

    @Test
    @DisplayName("존재하지 않는 테넌트의 목록 조회는 404")
    void getBookings_TenantNotFound() throws Exception {
        given(getBookingsUseCase.getBookings(eq(TENANT_ID), any(), any()))
                .willThrow(new TenantNotFoundException(TENANT_ID));

        mockMvc.perform(get(BOOKINGS_URL))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("T001"));
    }

    @Test
    @DisplayName("예약 취소 성공 시 CANCELLED 상태를 반환한다")
    void cancelBooking() throws Exception {
        given(changeBookingStatusUseCase.cancel(TENANT_ID, 100L)).willReturn(SchedulingResult.success(
                booking(100L, STAFF_ID, MONDAY, "10:00", "10:30", BookingStatus.CANCELLED)));

        mockMvc.perform(put(BOOKINGS_URL + "/100/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }
}
