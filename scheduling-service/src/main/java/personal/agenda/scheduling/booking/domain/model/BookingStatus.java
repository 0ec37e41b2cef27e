package personal.agenda.scheduling.booking.domain.model;

/**
 * Booking Status Enum
 * 예약 상태
 */
public enum BookingStatus {
    /**
     * 예약 접수 (확정 대기)
     */
    PENDING,

    /**
     * 예약 확정
     */
    CONFIRMED,

    /**
     * 서비스 완료 (시간은 계속 점유한 것으로 본다)
     */
    COMPLETED,

    /**
     * 예약 취소 (시간 점유 해제)
     */
    CANCELLED;

    public boolean occupiesTime() {
        return this != CANCELLED;
    }
}
