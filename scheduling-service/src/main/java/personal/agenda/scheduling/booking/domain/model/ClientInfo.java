package personal.agenda.scheduling.booking.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * 예약 고객 정보 (고객 계정 없이 예약 시점에 입력)
 */
public record ClientInfo(String name, String phone, String email) {

    public ClientInfo {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Client name cannot be blank");
        }
        if (phone == null || phone.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Client phone cannot be blank");
        }
    }
}
