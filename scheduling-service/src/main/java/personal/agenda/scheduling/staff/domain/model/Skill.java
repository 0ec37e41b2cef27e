package personal.agenda.scheduling.staff.domain.model;

import personal.agenda.common.exception.BusinessException;
import personal.agenda.common.exception.ErrorCode;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;

/**
 * Skill Domain Model
 * 직원이 수행할 수 있는 서비스와 직원별 소요 시간
 *
 * @param serviceId        서비스 ID
 * @param serviceName      서비스명 (표시용)
 * @param experienceLevel  숙련도 (표시용)
 * @param durationOverride 직원별 소요 시간(분), null이면 서비스 기본 시간 사용
 * @param canPerform       수행 가능 여부, 명시적으로 false인 경우에만 불가
 */
public record Skill(
        Long serviceId,
        String serviceName,
        ExperienceLevel experienceLevel,
        Integer durationOverride,
        Boolean canPerform) {

    public Skill {
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (durationOverride != null
                && (durationOverride <= 0 || durationOverride > TimeWindow.MINUTES_PER_DAY)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration override must be between 1 and 1440 minutes: " + durationOverride);
        }
        if (experienceLevel == null) {
            experienceLevel = ExperienceLevel.INTERMEDIATE;
        }
    }

    public static Skill of(Long serviceId, String serviceName) {
        return new Skill(serviceId, serviceName, ExperienceLevel.INTERMEDIATE, null, true);
    }

    public boolean isFor(Long serviceId) {
        return this.serviceId.equals(serviceId);
    }

    public boolean isPerformable() {
        return !Boolean.FALSE.equals(canPerform);
    }

    /**
     * 직원별 소요 시간이 있으면 그 값을, 없으면 서비스 기본 시간을 사용
     */
    public int effectiveDuration(int baseDuration) {
        return durationOverride != null ? durationOverride : baseDuration;
    }
}
