package personal.agenda.scheduling.staff.adapter.out.persistence;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.agenda.scheduling.staff.application.port.out.StaffRepository;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.util.List;
import java.util.Optional;

/**
 * Staff Persistence Adapter
 * JPA를 사용한 직원 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaffPersistenceAdapter implements StaffRepository {

    private final JpaStaffMemberRepository jpaStaffMemberRepository;

    @Override
    public StaffMember save(StaffMember staff) {
        log.debug("Saving staff: tenantId={}, staffId={}", staff.tenantId(), staff.id());
        return jpaStaffMemberRepository.save(StaffMemberEntity.fromDomain(staff)).toDomain();
    }

    @Override
    @Retry(name = "storeRead")
    public Optional<StaffMember> findById(Long staffId) {
        return jpaStaffMemberRepository.findById(staffId)
                .map(StaffMemberEntity::toDomain);
    }

    @Override
    @Retry(name = "storeRead")
    public List<StaffMember> findAllByTenantId(String tenantId) {
        return jpaStaffMemberRepository.findAllByTenantIdOrderByNameAsc(tenantId).stream()
                .map(StaffMemberEntity::toDomain)
                .toList();
    }

    @Override
    public void deleteById(Long staffId) {
        jpaStaffMemberRepository.deleteById(staffId);
    }
}
