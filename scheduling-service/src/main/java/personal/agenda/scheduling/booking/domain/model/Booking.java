package personal.agenda.scheduling.booking.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.exception.InvalidBookingTransitionException;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Booking Domain Model
 * 예약 도메인 모델 (불변)
 *
 * 서비스명, 가격, 직원명은 예약 시점 값으로 비정규화되어 저장된다.
 * endTime과 actualDuration은 생성 시 고정되며 이후 스킬 변경에 영향받지 않는다.
 */
public record Booking(
        Long id,
        String tenantId,
        Long serviceId,
        String serviceName,
        BigDecimal servicePrice,
        int serviceDuration,
        Long staffId,
        String staffName,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        int actualDuration,
        BookingStatus status,
        ClientInfo client,
        String notes,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Booking {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (date == null || startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date and times cannot be null");
        }
        if (!startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Booking start must be before end: start=%s, end=%s", startTime, endTime));
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (client == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Client info cannot be null");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @param staff          담당 직원, 미지정 예약이면 null
     * @param actualDuration 직원별 소요 시간이 반영된 실제 소요 시간(분)
     * @return 새로운 예약 (PENDING 상태)
     */
    public static Booking create(String tenantId, ServiceOffering service, StaffMember staff,
                                 LocalDate date, LocalTime startTime, int actualDuration,
                                 ClientInfo client, String notes) {
        TimeWindow window = TimeWindow.starting(startTime, actualDuration);
        LocalDateTime now = LocalDateTime.now();
        return new Booking(
                null,
                tenantId,
                service.id(),
                service.name(),
                service.price(),
                service.durationMinutes(),
                staff != null ? staff.id() : null,
                staff != null ? staff.name() : null,
                date,
                window.start(),
                window.end(),
                actualDuration,
                BookingStatus.PENDING,
                client,
                notes,
                now,
                now);
    }

    /**
     * 예약 확정 (PENDING -> CONFIRMED)
     */
    public Booking confirm() {
        if (status != BookingStatus.PENDING) {
            throw new InvalidBookingTransitionException(id, status, BookingStatus.CONFIRMED);
        }
        return withStatus(BookingStatus.CONFIRMED);
    }

    /**
     * 예약 취소 (PENDING/CONFIRMED -> CANCELLED)
     * 이미 취소되었거나 완료된 예약은 취소할 수 없다
     */
    public Booking cancel() {
        if (status == BookingStatus.CANCELLED || status == BookingStatus.COMPLETED) {
            throw new InvalidBookingTransitionException(id, status, BookingStatus.CANCELLED);
        }
        return withStatus(BookingStatus.CANCELLED);
    }

    /**
     * 서비스 완료 (CONFIRMED -> COMPLETED)
     */
    public Booking complete() {
        if (status != BookingStatus.CONFIRMED) {
            throw new InvalidBookingTransitionException(id, status, BookingStatus.COMPLETED);
        }
        return withStatus(BookingStatus.COMPLETED);
    }

    public boolean belongsTo(String requestTenantId) {
        return tenantId.equals(requestTenantId);
    }

    public boolean isAssigned() {
        return staffId != null;
    }

    /**
     * 시간대를 점유하는 예약인지 (취소된 예약만 제외)
     */
    public boolean occupiesTime() {
        return status.occupiesTime();
    }

    public TimeWindow window() {
        return new TimeWindow(startTime, endTime);
    }

    private Booking withStatus(BookingStatus newStatus) {
        return new Booking(id, tenantId, serviceId, serviceName, servicePrice, serviceDuration,
                staffId, staffName, date, startTime, endTime, actualDuration,
                newStatus, client, notes, createdAt, LocalDateTime.now());
    }
}
