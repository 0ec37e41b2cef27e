package personal.agenda.scheduling.availability.application.port.out;

import personal.agenda.scheduling.staff.domain.model.MatchedStaff;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Availability Cache Port (Output Port)
 *
 * 캐시 항목:
 * - slots:{tenantId}:{staffId}:{date}:{duration} → 시작 시각 목록 (짧은 TTL)
 * - roster:{tenantId}:{serviceId} → 서비스 수행 가능 직원 목록
 * - staff:{staffId} → 직원 정보
 *
 * 조회 오류는 캐시 미스로 처리한다.
 */
public interface AvailabilityCacheRepository {

    Optional<List<String>> findSlots(String tenantId, Long staffId, LocalDate date, int durationMinutes);

    void saveSlots(String tenantId, Long staffId, LocalDate date, int durationMinutes, List<String> slots);

    /**
     * 슬롯 무효화 세대 번호. 슬롯 무효화가 일어날 때마다 증가한다.
     * 예약 조회 전에 읽어 두고 saveSlotsIfCurrent에 넘긴다.
     */
    long slotGeneration();

    /**
     * 읽어 둔 세대 이후 무효화가 없었을 때만 저장
     *
     * @return 저장 여부 (false면 계산 도중 무효화되어 버린 목록)
     */
    boolean saveSlotsIfCurrent(String tenantId, Long staffId, LocalDate date, int durationMinutes,
                               List<String> slots, long generation);

    Optional<List<MatchedStaff>> findRoster(String tenantId, Long serviceId);

    void saveRoster(String tenantId, Long serviceId, List<MatchedStaff> roster);

    Optional<StaffMember> findStaff(Long staffId);

    void saveStaff(StaffMember staff);

    /**
     * 해당 직원/날짜의 모든 소요 시간별 슬롯 무효화 (예약 생성/상태 변경 시)
     */
    void evictSlots(String tenantId, Long staffId, LocalDate date);

    /**
     * 직원 변경 시 무효화: 테넌트 로스터 전체, 직원 정보, 해당 직원 슬롯 전체
     */
    void invalidateStaff(String tenantId, Long staffId);

    void clear();

    /**
     * 캐시별 추정 항목 수 (헬스 체크용)
     */
    Map<String, Long> estimatedSizes();
}
