package personal.agenda.scheduling.booking.domain.model;

import java.util.function.Function;

/**
 * 스케줄링 연산 결과
 * 성공 시 value, 실패 시 failure 중 하나만 존재한다
 */
public record SchedulingResult<T>(T value, SchedulingFailure failure) {

    public static <T> SchedulingResult<T> success(T value) {
        return new SchedulingResult<>(value, null);
    }

    public static <T> SchedulingResult<T> failure(SchedulingFailure failure) {
        return new SchedulingResult<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public FailureReason failureReason() {
        return failure != null ? failure.reason() : null;
    }

    public <R> SchedulingResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure);
    }

    /**
     * 성공 값 반환, 실패면 SchedulingRejectedException으로 변환하여 던진다
     * Web Adapter에서 GlobalExceptionHandler로 위임할 때 사용
     */
    public T getOrThrow() {
        if (isFailure()) {
            throw failure.toException();
        }
        return value;
    }
}
