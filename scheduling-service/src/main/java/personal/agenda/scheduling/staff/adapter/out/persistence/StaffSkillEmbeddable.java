package personal.agenda.scheduling.staff.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;
import personal.agenda.scheduling.staff.domain.model.Skill;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffSkillEmbeddable {

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "service_name", length = 200)
    private String serviceName;

    @Enumerated(EnumType.STRING)
    @Column(name = "experience_level", length = 20)
    private ExperienceLevel experienceLevel;

    @Column(name = "duration_override")
    private Integer durationOverride;

    @Column(name = "can_perform")
    private Boolean canPerform;

    public static StaffSkillEmbeddable fromDomain(Skill skill) {
        StaffSkillEmbeddable embeddable = new StaffSkillEmbeddable();
        embeddable.serviceId = skill.serviceId();
        embeddable.serviceName = skill.serviceName();
        embeddable.experienceLevel = skill.experienceLevel();
        embeddable.durationOverride = skill.durationOverride();
        embeddable.canPerform = skill.canPerform();
        return embeddable;
    }

    public Skill toDomain() {
        return new Skill(serviceId, serviceName, experienceLevel, durationOverride, canPerform);
    }
}
