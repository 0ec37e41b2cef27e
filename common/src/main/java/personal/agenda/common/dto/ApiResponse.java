package personal.agenda.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 운영성 조회 API(헬스 체크 등)의 공통 응답 포맷
 * 예약/가용성 API는 도메인 DTO를 직접 반환하고, 오류는 ErrorResponse로 내려간다.
 *
 * @param result  "success" 또는 "error"
 * @param message 응답 메시지
 * @param data    응답 데이터
 */
public record ApiResponse<T>(
        String result,
        String message,
        T data
) {
    private static final String SUCCESS = "success";
    private static final String ERROR = "error";

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(SUCCESS, message, data);
    }

    public static <T> ApiResponse<T> error(String message, T data) {
        return new ApiResponse<>(ERROR, message, data);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(result);
    }
}
