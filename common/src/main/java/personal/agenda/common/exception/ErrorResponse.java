package personal.agenda.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 *
 * @param code      ErrorCode의 코드 값 (예: B003)
 * @param message   사용자 노출용 메시지
 * @param detail    원인 상세 (없으면 생략)
 * @param timestamp 발생 시각
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        String detail,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, null, LocalDateTime.now());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, String detail) {
        return new ErrorResponse(errorCode.getCode(), message, detail, LocalDateTime.now());
    }
}
