package personal.agenda.scheduling.staff.domain.model;

/**
 * 서비스 수행 가능 직원과 매칭된 스킬
 */
public record MatchedStaff(StaffMember staff, Skill skill) {

    public int effectiveDuration(int baseDuration) {
        return skill.effectiveDuration(baseDuration);
    }
}
