package personal.agenda.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Tenant / Catalog (Txxx)
    TENANT_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "업체를 찾을 수 없습니다."),
    SERVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "T002", "서비스를 찾을 수 없습니다."),

    // Staff (Sxxx)
    STAFF_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "직원을 찾을 수 없습니다."),
    STAFF_INACTIVE(HttpStatus.BAD_REQUEST, "S002", "비활성 상태의 직원입니다."),
    STAFF_SKILL_MISMATCH(HttpStatus.BAD_REQUEST, "S003", "직원이 해당 서비스를 수행할 수 없습니다."),
    SKILL_ALREADY_ASSIGNED(HttpStatus.CONFLICT, "S004", "이미 등록된 스킬입니다."),

    // Booking (Bxxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    SCHEDULE_UNAVAILABLE(HttpStatus.BAD_REQUEST, "B002", "근무 시간이 아닙니다."),
    SCHEDULING_CONFLICT(HttpStatus.CONFLICT, "B003", "이미 예약된 시간입니다."),
    INVALID_BOOKING_TRANSITION(HttpStatus.BAD_REQUEST, "B004", "예약 상태를 변경할 수 없습니다."),

    // External (Exxx)
    UPSTREAM_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "E001", "저장소 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
