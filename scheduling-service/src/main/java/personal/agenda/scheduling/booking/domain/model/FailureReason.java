package personal.agenda.scheduling.booking.domain.model;

import personal.agenda.common.exception.ErrorCode;

import java.util.Optional;

/**
 * 스케줄링 실패 사유 분류
 */
public enum FailureReason {
    NOT_FOUND,
    INACTIVE_RESOURCE,
    CAPABILITY_MISMATCH,
    SCHEDULE_UNAVAILABLE,
    SCHEDULING_CONFLICT,
    INVALID_TRANSITION,
    UPSTREAM_FAILURE;

    /**
     * ErrorCode를 실패 사유로 변환
     * 입력 검증 오류처럼 분류 대상이 아닌 코드는 empty
     */
    public static Optional<FailureReason> from(ErrorCode errorCode) {
        FailureReason reason = switch (errorCode) {
            case NOT_FOUND, TENANT_NOT_FOUND, SERVICE_NOT_FOUND, STAFF_NOT_FOUND, BOOKING_NOT_FOUND -> NOT_FOUND;
            case STAFF_INACTIVE -> INACTIVE_RESOURCE;
            case STAFF_SKILL_MISMATCH -> CAPABILITY_MISMATCH;
            case SCHEDULE_UNAVAILABLE -> SCHEDULE_UNAVAILABLE;
            case CONFLICT, SCHEDULING_CONFLICT -> SCHEDULING_CONFLICT;
            case INVALID_BOOKING_TRANSITION -> INVALID_TRANSITION;
            case UPSTREAM_FAILURE -> UPSTREAM_FAILURE;
            default -> null;
        };
        return Optional.ofNullable(reason);
    }
}
