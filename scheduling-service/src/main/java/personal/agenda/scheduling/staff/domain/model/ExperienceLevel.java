package personal.agenda.scheduling.staff.domain.model;

/**
 * 직원 숙련도
 * 표시용 정보이며 소요 시간/가격 계산에는 영향을 주지 않는다
 */
public enum ExperienceLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT
}
