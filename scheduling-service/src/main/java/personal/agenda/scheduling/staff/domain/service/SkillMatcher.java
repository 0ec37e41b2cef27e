package personal.agenda.scheduling.staff.domain.service;

import org.springframework.stereotype.Component;
import personal.agenda.scheduling.staff.domain.model.MatchedStaff;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.util.List;

/**
 * Skill Matcher (Domain Service)
 * 테넌트 직원 목록 중 특정 서비스를 수행할 수 있는 활성 직원을 선별
 *
 * 조건: 같은 테넌트, 활성 상태, canPerform이 false가 아닌 해당 서비스 스킬 보유.
 * 입력 순서를 유지한다.
 */
@Component
public class SkillMatcher {

    public List<MatchedStaff> match(String tenantId, Long serviceId, List<StaffMember> roster) {
        return roster.stream()
                .filter(staff -> staff.belongsTo(tenantId))
                .filter(StaffMember::active)
                .flatMap(staff -> staff.findPerformableSkill(serviceId)
                        .map(skill -> new MatchedStaff(staff, skill))
                        .stream())
                .toList();
    }
}
