package personal.agenda.scheduling.catalog.domain.exception;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;

public class TenantNotFoundException extends BusinessException {
    public TenantNotFoundException(String tenantId) {
        super(ErrorCode.TENANT_NOT_FOUND,
                String.format("Tenant not found: tenantId=%s", tenantId));
    }
}
