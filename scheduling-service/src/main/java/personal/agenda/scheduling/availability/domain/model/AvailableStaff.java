package personal.agenda.scheduling.availability.domain.model;

import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;

import java.math.BigDecimal;

/**
 * 요청 시각에 서비스를 수행할 수 있는 직원
 *
 * @param durationMinutes 이 직원 기준 소요 시간(분)
 * @param price           서비스 기본 가격
 */
public record AvailableStaff(
        Long staffId,
        String name,
        String position,
        ExperienceLevel experienceLevel,
        int durationMinutes,
        BigDecimal price) {
}
