package personal.agenda.scheduling.staff.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;
import personal.agenda.scheduling.staff.application.port.out.StaffRepository;
import personal.agenda.scheduling.staff.domain.exception.StaffNotFoundException;
import personal.agenda.scheduling.staff.domain.model.MatchedStaff;
import personal.agenda.scheduling.staff.domain.model.StaffMember;
import personal.agenda.scheduling.staff.domain.service.SkillMatcher;

import java.util.List;
import java.util.Optional;

/**
 * Staff Query Cache Service
 * 가용성 조회 경로의 직원/로스터 조회 (캐시 우선, MISS 시 저장소)
 *
 * 예약 생성 경로는 이 서비스를 거치지 않고 저장소를 직접 조회한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaffQueryCacheService {

    private final StaffRepository staffRepository;
    private final AvailabilityCacheRepository availabilityCache;
    private final SkillMatcher skillMatcher;

    /**
     * @throws StaffNotFoundException 직원이 없을 때
     */
    public StaffMember getStaff(Long staffId) {
        Optional<StaffMember> cached = availabilityCache.findStaff(staffId);
        if (cached.isPresent()) {
            return cached.get();
        }

        StaffMember staff = staffRepository.findById(staffId)
                .orElseThrow(() -> new StaffNotFoundException(staffId));
        availabilityCache.saveStaff(staff);
        return staff;
    }

    /**
     * 서비스 수행 가능 직원 로스터 (테넌트/서비스 단위 캐싱)
     */
    public List<MatchedStaff> findCapableStaff(String tenantId, Long serviceId) {
        Optional<List<MatchedStaff>> cached = availabilityCache.findRoster(tenantId, serviceId);
        if (cached.isPresent()) {
            return cached.get();
        }

        log.info("Roster cache MISS - Loading staff from store: tenantId={}, serviceId={}", tenantId, serviceId);
        List<MatchedStaff> roster = skillMatcher.match(tenantId, serviceId,
                staffRepository.findAllByTenantId(tenantId));
        availabilityCache.saveRoster(tenantId, serviceId, roster);

        log.debug("Roster loaded: tenantId={}, serviceId={}, capableCount={}",
                tenantId, serviceId, roster.size());
        return roster;
    }
}
