package personal.agenda.scheduling.staff.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.agenda.scheduling.staff.domain.model.DaySchedule;
import personal.agenda.scheduling.staff.domain.model.StaffMember;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Staff Member JPA Entity
 * 직원 테이블 매핑 (스킬, 요일별 근무 정보는 컬렉션 테이블)
 */
@Entity
@Table(name = "staff_members",
        indexes = @Index(name = "idx_staff_members_tenant", columnList = "tenant_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffMemberEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 200)
    private String email;

    @Column(length = 100)
    private String position;

    @Column(nullable = false)
    private boolean active;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_skills", joinColumns = @JoinColumn(name = "staff_id"))
    @OrderColumn(name = "skill_order")
    private List<StaffSkillEmbeddable> skills = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_work_days", joinColumns = @JoinColumn(name = "staff_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "day_of_week", length = 10)
    private Map<DayOfWeek, WorkDayEmbeddable> workDays = new HashMap<>();

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static StaffMemberEntity fromDomain(StaffMember staff) {
        StaffMemberEntity entity = new StaffMemberEntity();
        entity.id = staff.id();
        entity.tenantId = staff.tenantId();
        entity.name = staff.name();
        entity.email = staff.email();
        entity.position = staff.position();
        entity.active = staff.active();
        staff.skills().forEach(skill -> entity.skills.add(StaffSkillEmbeddable.fromDomain(skill)));
        staff.workSchedule().days().forEach((day, schedule) ->
                entity.workDays.put(day, WorkDayEmbeddable.fromDomain(schedule)));
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public StaffMember toDomain() {
        Map<DayOfWeek, DaySchedule> days = new EnumMap<>(DayOfWeek.class);
        workDays.forEach((day, schedule) -> days.put(day, schedule.toDomain()));
        return new StaffMember(id, tenantId, name, email, position, active,
                skills.stream().map(StaffSkillEmbeddable::toDomain).toList(),
                new WorkSchedule(days));
    }
}
