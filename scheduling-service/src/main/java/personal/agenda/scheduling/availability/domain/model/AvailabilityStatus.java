package personal.agenda.scheduling.availability.domain.model;

/**
 * 특정 시각 가용 여부 판정 결과
 */
public enum AvailabilityStatus {
    AVAILABLE,
    NOT_WORKING,
    OUTSIDE_WORKING_HOURS,
    DURING_BREAK,
    CONFLICT
}
