package personal.agenda.scheduling.catalog.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Service Offering Domain Model
 * 테넌트가 제공하는 예약 가능한 서비스 (기본 가격, 기본 소요 시간)
 */
public record ServiceOffering(
        Long id,
        String tenantId,
        String name,
        BigDecimal price,
        int durationMinutes,
        boolean active) {

    public ServiceOffering {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be blank");
        }
        if (price == null || price.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service price must not be negative");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Service duration must be positive: " + durationMinutes);
        }
    }
}
