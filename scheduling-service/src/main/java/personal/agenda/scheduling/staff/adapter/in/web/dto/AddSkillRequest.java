package personal.agenda.scheduling.staff.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;

/**
 * 스킬 추가 요청 DTO
 *
 * @param durationOverride 직원별 소요 시간(분), 생략 시 서비스 기본 시간
 */
public record AddSkillRequest(
        @NotNull(message = "서비스 ID는 필수입니다.")
        Long serviceId,

        ExperienceLevel experienceLevel,

        @Min(value = 1, message = "소요 시간은 1분 이상이어야 합니다.")
        @Max(value = 1440, message = "소요 시간은 1440분 이하여야 합니다.")
        Integer durationOverride
) {
}
