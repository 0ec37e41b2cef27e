package personal.agenda.scheduling.catalog.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

/**
 * Service Not Found Exception
 * 테넌트에 해당 서비스가 없을 때 발생하는 예외
 */
public class ServiceNotFoundException extends BusinessException {
    public ServiceNotFoundException(String tenantId, Long serviceId) {
        super(ErrorCode.SERVICE_NOT_FOUND,
                String.format("Service not found: tenantId=%s, serviceId=%d", tenantId, serviceId));
    }
}
