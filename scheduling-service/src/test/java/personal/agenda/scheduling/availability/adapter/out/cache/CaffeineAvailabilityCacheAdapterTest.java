package personal.agenda.scheduling.availability.adapter.out.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.agenda.scheduling.acceptance.support.MutableTicker;
import personal.agenda.scheduling.staff.domain.model.MatchedStaff;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.agenda.scheduling.support.SchedulingFixtures.*;

@DisplayName("CaffeineAvailabilityCacheAdapter 테스트")
class CaffeineAvailabilityCacheAdapterTest {

    private MutableTicker ticker;
    private CaffeineAvailabilityCacheAdapter cache;

    @BeforeEach
    void setUp() {
        ticker = new MutableTicker();
        cache = new CaffeineAvailabilityCacheAdapter(
                new AvailabilityCacheProperties(Duration.ofMinutes(2), Duration.ofMinutes(5)), ticker);
    }

    @Test
    @DisplayName("슬롯은 TTL 이전에는 HIT, 이후에는 MISS")
    void slotTtl() {
        // given
        cache.saveSlots(TENANT_ID, STAFF_ID, MONDAY, 30, List.of("09:00", "09:15"));

        // when & then
        ticker.advance(Duration.ofSeconds(119));
        assertThat(cache.findSlots(TENANT_ID, STAFF_ID, MONDAY, 30)).contains(List.of("09:00", "09:15"));

        ticker.advance(Duration.ofSeconds(2));
        assertThat(cache.findSlots(TENANT_ID, STAFF_ID, MONDAY, 30)).isEmpty();
    }

    @Test
    @DisplayName("직원 정보와 로스터는 슬롯보다 긴 TTL을 가진다")
    void rosterTtl() {
        // given
        StaffMember staff = haircutStaff();
        cache.saveStaff(staff);
        cache.saveRoster(TENANT_ID, SERVICE_ID, List.of(new MatchedStaff(staff, staff.skills().get(0))));

        // when
        ticker.advance(Duration.ofMinutes(3));

        // then
        assertThat(cache.findStaff(STAFF_ID)).contains(staff);
        assertThat(cache.findRoster(TENANT_ID, SERVICE_ID)).isPresent();

        ticker.advance(Duration.ofMinutes(3));
        assertThat(cache.findStaff(STAFF_ID)).isEmpty();
        assertThat(cache.findRoster(TENANT_ID, SERVICE_ID)).isEmpty();
    }

    @Test
    @DisplayName("슬롯 무효화는 해당 직원/날짜의 모든 소요 시간 항목만 제거한다")
    void evictSlotsByPrefix() {
        // given
        cache.saveSlots(TENANT_ID, 1L, MONDAY, 30, List.of("09:00"));
        cache.saveSlots(TENANT_ID, 1L, MONDAY, 60, List.of("09:00"));
        cache.saveSlots(TENANT_ID, 11L, MONDAY, 30, List.of("10:00"));
        cache.saveSlots(TENANT_ID, 1L, MONDAY.plusDays(1), 30, List.of("11:00"));

        // when
        cache.evictSlots(TENANT_ID, 1L, MONDAY);

        // then
        assertThat(cache.findSlots(TENANT_ID, 1L, MONDAY, 30)).isEmpty();
        assertThat(cache.findSlots(TENANT_ID, 1L, MONDAY, 60)).isEmpty();
        assertThat(cache.findSlots(TENANT_ID, 11L, MONDAY, 30)).isPresent();
        assertThat(cache.findSlots(TENANT_ID, 1L, MONDAY.plusDays(1), 30)).isPresent();
    }

    @Test
    @DisplayName("세대 번호 이후 무효화가 없으면 슬롯 목록을 저장한다")
    void saveSlotsIfCurrent() {
        long generation = cache.slotGeneration();

        boolean saved = cache.saveSlotsIfCurrent(TENANT_ID, STAFF_ID, MONDAY, 30, List.of("09:00"), generation);

        assertThat(saved).isTrue();
        assertThat(cache.findSlots(TENANT_ID, STAFF_ID, MONDAY, 30)).contains(List.of("09:00"));
    }

    @Test
    @DisplayName("계산 도중 무효화된 슬롯 목록은 저장하지 않는다")
    void discardsSlotsComputedBeforeEviction() {
        // given: 예약 조회 전에 세대 번호를 읽고, 그 사이 예약 생성으로 무효화
        long generation = cache.slotGeneration();
        cache.evictSlots(TENANT_ID, STAFF_ID, MONDAY);

        // when
        boolean saved = cache.saveSlotsIfCurrent(TENANT_ID, STAFF_ID, MONDAY, 30, List.of("09:00"), generation);

        // then
        assertThat(saved).isFalse();
        assertThat(cache.findSlots(TENANT_ID, STAFF_ID, MONDAY, 30)).isEmpty();
    }

    @Test
    @DisplayName("직원 무효화와 전체 초기화도 세대 번호를 올린다")
    void invalidationsAdvanceGeneration() {
        long initial = cache.slotGeneration();

        cache.invalidateStaff(TENANT_ID, STAFF_ID);
        long afterStaff = cache.slotGeneration();
        cache.clear();

        assertThat(afterStaff).isGreaterThan(initial);
        assertThat(cache.slotGeneration()).isGreaterThan(afterStaff);
    }

    @Test
    @DisplayName("직원 무효화는 테넌트 로스터 전체와 해당 직원의 정보/슬롯을 제거한다")
    void invalidateStaff() {
        // given
        StaffMember staff = haircutStaff();
        cache.saveStaff(staff);
        cache.saveRoster(TENANT_ID, SERVICE_ID, List.of());
        cache.saveRoster(TENANT_ID, 99L, List.of());
        cache.saveRoster(OTHER_TENANT_ID, SERVICE_ID, List.of());
        cache.saveSlots(TENANT_ID, STAFF_ID, MONDAY, 30, List.of("09:00"));
        cache.saveSlots(TENANT_ID, 2L, MONDAY, 30, List.of("09:00"));

        // when
        cache.invalidateStaff(TENANT_ID, STAFF_ID);

        // then
        assertThat(cache.findStaff(STAFF_ID)).isEmpty();
        assertThat(cache.findRoster(TENANT_ID, SERVICE_ID)).isEmpty();
        assertThat(cache.findRoster(TENANT_ID, 99L)).isEmpty();
        assertThat(cache.findRoster(OTHER_TENANT_ID, SERVICE_ID)).isPresent();
        assertThat(cache.findSlots(TENANT_ID, STAFF_ID, MONDAY, 30)).isEmpty();
        assertThat(cache.findSlots(TENANT_ID, 2L, MONDAY, 30)).isPresent();
    }

    @Test
    @DisplayName("저장된 슬롯 목록은 호출자의 목록 변경에 영향받지 않는다")
    void savedSlotsAreCopied() {
        List<String> slots = new java.util.ArrayList<>(List.of("09:00"));
        cache.saveSlots(TENANT_ID, STAFF_ID, MONDAY, 30, slots);

        slots.add("09:15");

        assertThat(cache.findSlots(TENANT_ID, STAFF_ID, MONDAY, 30)).contains(List.of("09:00"));
    }

    @Test
    @DisplayName("clear 후 추정 크기는 0")
    void clear() {
        cache.saveSlots(TENANT_ID, STAFF_ID, MONDAY, 30, List.of("09:00"));
        cache.saveStaff(haircutStaff());

        cache.clear();

        assertThat(cache.estimatedSizes()).containsOnlyKeys("slots", "rosters", "staff");
        assertThat(cache.findStaff(STAFF_ID)).isEmpty();
    }
}
