package personal.agenda.scheduling.availability.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.agenda.scheduling.availability.adapter.in.web.dto.AvailabilityCheckRequest;
import personal.agenda.scheduling.availability.adapter.in.web.dto.AvailabilityCheckResponse;
import personal.agenda.scheduling.availability.adapter.in.web.dto.AvailableStaffResponse;
import personal.agenda.scheduling.availability.adapter.in.web.dto.ServiceSlotsResponse;
import personal.agenda.scheduling.availability.adapter.in.web.dto.TimeSlotsResponse;
import personal.agenda.scheduling.availability.application.port.in.AvailableStaffQuery;
import personal.agenda.scheduling.availability.application.port.in.CheckStaffAvailabilityUseCase;
import personal.agenda.scheduling.availability.application.port.in.FindAvailableStaffUseCase;
import personal.agenda.scheduling.availability.application.port.in.GenerateTimeSlotsUseCase;
import personal.agenda.scheduling.availability.application.port.in.GetServiceSlotsUseCase;
import personal.agenda.scheduling.availability.application.port.in.ServiceSlotsQuery;
import personal.agenda.scheduling.availability.application.port.in.TimeSlotQuery;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Availability API Controller
 * 가용 시각 조회, 가용 여부 확인, 서비스별 가용 직원 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AvailabilityController {

    private static final int DEFAULT_DURATION_MINUTES = 30;

    private final GenerateTimeSlotsUseCase generateTimeSlotsUseCase;
    private final CheckStaffAvailabilityUseCase checkStaffAvailabilityUseCase;
    private final FindAvailableStaffUseCase findAvailableStaffUseCase;
    private final GetServiceSlotsUseCase getServiceSlotsUseCase;

    /**
     * 직원 예약 가능 시각 조회
     * GET /api/v1/staff/{staffId}/availability/slots?date=2024-01-15&duration=30
     */
    @GetMapping("/staff/{staffId}/availability/slots")
    public ResponseEntity<TimeSlotsResponse> getTimeSlots(
            @PathVariable Long staffId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @Min(1) @Max(1440) Integer duration
    ) {
        int durationMinutes = duration != null ? duration : DEFAULT_DURATION_MINUTES;
        log.info("Get time slots: staffId={}, date={}, duration={}", staffId, date, durationMinutes);

        List<String> slots = generateTimeSlotsUseCase
                .generateTimeSlots(new TimeSlotQuery(staffId, date, durationMinutes))
                .getOrThrow();

        return ResponseEntity.ok(new TimeSlotsResponse(staffId, date, durationMinutes, slots));
    }

    /**
     * 특정 시각 가용 여부 확인
     * POST /api/v1/staff/availability/check
     */
    @PostMapping("/staff/availability/check")
    public ResponseEntity<AvailabilityCheckResponse> checkAvailability(
            @Valid @RequestBody AvailabilityCheckRequest request
    ) {
        log.info("Check availability: staffId={}, date={}, startTime={}, duration={}",
                request.staffId(), request.date(), request.startTime(), request.durationMinutes());

        var availability = checkStaffAvailabilityUseCase.isStaffAvailableAt(request.toQuery()).getOrThrow();

        return ResponseEntity.ok(AvailabilityCheckResponse.from(availability));
    }

    /**
     * 서비스 수행 가능 + 요청 시각 가용 직원 조회
     * GET /api/v1/tenants/{tenantId}/services/{serviceId}/available-staff?date=&startTime=&duration=
     */
    @GetMapping("/tenants/{tenantId}/services/{serviceId}/available-staff")
    public ResponseEntity<List<AvailableStaffResponse>> getAvailableStaff(
            @PathVariable String tenantId,
            @PathVariable Long serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime startTime,
            @RequestParam(required = false) @Min(1) @Max(1440) Integer duration
    ) {
        log.info("Get available staff: tenantId={}, serviceId={}, date={}, startTime={}, duration={}",
                tenantId, serviceId, date, startTime, duration);

        var query = new AvailableStaffQuery(tenantId, serviceId, date, startTime, duration);
        List<AvailableStaffResponse> response = findAvailableStaffUseCase.listAvailableStaffForService(query)
                .getOrThrow()
                .stream()
                .map(AvailableStaffResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 직원-서비스 조합 예약 가능 시각 조회
     * GET /api/v1/tenants/{tenantId}/staff/{staffId}/service-slots?serviceId=&date=
     */
    @GetMapping("/tenants/{tenantId}/staff/{staffId}/service-slots")
    public ResponseEntity<ServiceSlotsResponse> getServiceSlots(
            @PathVariable String tenantId,
            @PathVariable Long staffId,
            @RequestParam Long serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        var serviceSlots = getServiceSlotsUseCase
                .getServiceSlots(new ServiceSlotsQuery(tenantId, staffId, serviceId, date))
                .getOrThrow();

        return ResponseEntity.ok(ServiceSlotsResponse.from(serviceSlots));
    }
}
