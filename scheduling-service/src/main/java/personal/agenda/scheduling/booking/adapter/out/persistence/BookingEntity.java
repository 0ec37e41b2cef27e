package personal.agenda.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;
import personal.agenda.scheduling.booking.domain.model.ClientInfo;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑 (서비스명/가격/직원명은 예약 시점 값)
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_bookings_tenant_date", columnList = "tenant_id, booking_date"),
                @Index(name = "idx_bookings_staff_date", columnList = "staff_id, booking_date")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "service_name", length = 200)
    private String serviceName;

    @Column(name = "service_price", precision = 12, scale = 2)
    private BigDecimal servicePrice;

    @Column(name = "service_duration", nullable = false)
    private int serviceDuration;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "staff_name", length = 200)
    private String staffName;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "actual_duration", nullable = false)
    private int actualDuration;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "client_name", nullable = false, length = 200)
    private String clientName;

    @Column(name = "client_phone", nullable = false, length = 50)
    private String clientPhone;

    @Column(name = "client_email", length = 200)
    private String clientEmail;

    @Column(length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.tenantId = booking.tenantId();
        entity.serviceId = booking.serviceId();
        entity.serviceName = booking.serviceName();
        entity.servicePrice = booking.servicePrice();
        entity.serviceDuration = booking.serviceDuration();
        entity.staffId = booking.staffId();
        entity.staffName = booking.staffName();
        entity.bookingDate = booking.date();
        entity.startTime = booking.startTime();
        entity.endTime = booking.endTime();
        entity.actualDuration = booking.actualDuration();
        entity.status = booking.status();
        entity.clientName = booking.client().name();
        entity.clientPhone = booking.client().phone();
        entity.clientEmail = booking.client().email();
        entity.notes = booking.notes();
        entity.createdAt = booking.createdAt();
        entity.updatedAt = booking.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Booking toDomain() {
        return new Booking(id, tenantId, serviceId, serviceName, servicePrice, serviceDuration,
                staffId, staffName, bookingDate, startTime, endTime, actualDuration, status,
                new ClientInfo(clientName, clientPhone, clientEmail), notes, createdAt, updatedAt);
    }

    /**
     * 상태 업데이트 (영속성 컨텍스트 내에서 사용)
     */
    public void updateStatus(BookingStatus newStatus) {
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
    }
}
