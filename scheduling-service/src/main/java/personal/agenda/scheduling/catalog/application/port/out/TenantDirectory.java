package personal.agenda.scheduling.catalog.application.port.out;

/**
 * Tenant Directory Port (Output Port)
 */
public interface TenantDirectory {

    boolean exists(String tenantId);
}
