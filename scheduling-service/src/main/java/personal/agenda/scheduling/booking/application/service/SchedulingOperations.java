package personal.agenda.scheduling.booking.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import personal.agenda.common.exception.BusinessException;
import personal.agenda.scheduling.booking.domain.model.FailureReason;
import personal.agenda.scheduling.booking.domain.model.SchedulingFailure;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Scheduling Operations
 * 도메인 예외와 저장소 예외를 SchedulingResult 실패로 변환
 *
 * 분류되지 않는 BusinessException(입력 검증 등)은 그대로 전파한다.
 */
@Slf4j
public final class SchedulingOperations {

    private SchedulingOperations() {
        // Utility class
    }

    public static <T> SchedulingResult<T> capture(String operation, Supplier<T> action) {
        try {
            return SchedulingResult.success(action.get());
        } catch (BusinessException e) {
            Optional<FailureReason> reason = FailureReason.from(e.getErrorCode());
            if (reason.isEmpty()) {
                throw e;
            }
            if (reason.get() == FailureReason.UPSTREAM_FAILURE) {
                log.error("Scheduling failed: operation={}, detail={}", operation, e.getMessage(), e);
            } else {
                log.warn("Scheduling rejected: operation={}, reason={}, detail={}",
                        operation, reason.get(), e.getMessage());
            }
            return SchedulingResult.failure(SchedulingFailure.of(reason.get(), e));
        } catch (DataAccessException e) {
            log.error("Store access failed: operation={}, error={}", operation, e.getMessage(), e);
            return SchedulingResult.failure(SchedulingFailure.upstream(e));
        }
    }
}
