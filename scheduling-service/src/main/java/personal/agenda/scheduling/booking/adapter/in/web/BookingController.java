package personal.agenda.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.agenda.scheduling.booking.adapter.in.web.dto.BookingResponse;
import personal.agenda.scheduling.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.agenda.scheduling.booking.application.port.in.ChangeBookingStatusUseCase;
import personal.agenda.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.agenda.scheduling.booking.application.port.in.GetBookingsUseCase;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Booking API Controller
 * 예약 생성, 조회, 상태 변경 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final ChangeBookingStatusUseCase changeBookingStatusUseCase;
    private final GetBookingsUseCase getBookingsUseCase;

    /**
     * 예약 생성
     * POST /api/v1/tenants/{tenantId}/bookings
     */
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(
            @PathVariable String tenantId,
            @Valid @RequestBody CreateBookingRequest request
    ) {
        log.info("Create booking: tenantId={}, serviceId={}, staffId={}, date={}, startTime={}",
                tenantId, request.serviceId(), request.staffId(), request.date(), request.startTime());

        Booking booking = createBookingUseCase.createBooking(request.toCommand(tenantId)).getOrThrow();

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예약 목록 조회
     * GET /api/v1/tenants/{tenantId}/bookings?date=&status=
     */
    @GetMapping
    public ResponseEntity<List<BookingResponse>> getBookings(
            @PathVariable String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) BookingStatus status
    ) {
        List<BookingResponse> response = getBookingsUseCase.getBookings(tenantId, date, status).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{bookingId}/confirm")
    public ResponseEntity<BookingResponse> confirm(@PathVariable String tenantId, @PathVariable Long bookingId) {
        log.info("Confirm booking: tenantId={}, bookingId={}", tenantId, bookingId);
        Booking booking = changeBookingStatusUseCase.confirm(tenantId, bookingId).getOrThrow();
        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    @PutMapping("/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancel(@PathVariable String tenantId, @PathVariable Long bookingId) {
        log.info("Cancel booking: tenantId={}, bookingId={}", tenantId, bookingId);
        Booking booking = changeBookingStatusUseCase.cancel(tenantId, bookingId).getOrThrow();
        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    @PutMapping("/{bookingId}/complete")
    public ResponseEntity<BookingResponse> complete(@PathVariable String tenantId, @PathVariable Long bookingId) {
        log.info("Complete booking: tenantId={}, bookingId={}", tenantId, bookingId);
        Booking booking = changeBookingStatusUseCase.complete(tenantId, bookingId).getOrThrow();
        return ResponseEntity.ok(BookingResponse.from(booking));
    }
}
