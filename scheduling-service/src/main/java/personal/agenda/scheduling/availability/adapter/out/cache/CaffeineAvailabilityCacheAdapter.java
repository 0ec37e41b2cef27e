package personal.agenda.scheduling.availability.adapter.out.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;
import personal.agenda.scheduling.staff.domain.model.MatchedStaff;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine Availability Cache Adapter
 *
 * 프로세스 로컬 캐시 (인스턴스 간 공유하지 않음)
 * - slots: slotTtl 후 만료
 * - roster, staff: rosterTtl 후 만료
 *
 * 접두사 기반 무효화는 keySet().removeIf로 처리한다.
 * 슬롯 무효화는 먼저 세대 번호를 올린 뒤 항목을 지운다. 계산 중 무효화된 슬롯 목록은 저장하지 않는다.
 * 조회 중 오류는 MISS로 처리하여 저장소 조회로 대체한다.
 */
@Slf4j
@Component
public class CaffeineAvailabilityCacheAdapter implements AvailabilityCacheRepository {

    private static final String SLOTS_PREFIX = "slots:";
    private static final String ROSTER_PREFIX = "roster:";
    private static final String STAFF_PREFIX = "staff:";

    private final Cache<String, List<String>> slotCache;
    private final Cache<String, List<MatchedStaff>> rosterCache;
    private final Cache<String, StaffMember> staffCache;
    private final AtomicLong slotGeneration = new AtomicLong();

    public CaffeineAvailabilityCacheAdapter(AvailabilityCacheProperties properties, Ticker availabilityCacheTicker) {
        this.slotCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.slotTtl())
                .ticker(availabilityCacheTicker)
                .build();
        this.rosterCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.rosterTtl())
                .ticker(availabilityCacheTicker)
                .build();
        this.staffCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.rosterTtl())
                .ticker(availabilityCacheTicker)
                .build();
        log.info("Availability cache initialized: slotTtl={}, rosterTtl={}",
                properties.slotTtl(), properties.rosterTtl());
    }

    @Override
    public Optional<List<String>> findSlots(String tenantId, Long staffId, LocalDate date, int durationMinutes) {
        return lookup(slotCache, slotKey(tenantId, staffId, date, durationMinutes));
    }

    @Override
    public void saveSlots(String tenantId, Long staffId, LocalDate date, int durationMinutes, List<String> slots) {
        slotCache.put(slotKey(tenantId, staffId, date, durationMinutes), List.copyOf(slots));
    }

    @Override
    public long slotGeneration() {
        return slotGeneration.get();
    }

    @Override
    public boolean saveSlotsIfCurrent(String tenantId, Long staffId, LocalDate date, int durationMinutes,
                                      List<String> slots, long generation) {
        String key = slotKey(tenantId, staffId, date, durationMinutes);
        if (slotGeneration.get() != generation) {
            log.debug("Stale slot list discarded: key={}", key);
            return false;
        }
        slotCache.put(key, List.copyOf(slots));
        // put 직후 무효화가 끼어들었으면 방금 저장한 항목을 되돌린다
        if (slotGeneration.get() != generation) {
            slotCache.invalidate(key);
            log.debug("Stale slot list discarded: key={}", key);
            return false;
        }
        return true;
    }

    @Override
    public Optional<List<MatchedStaff>> findRoster(String tenantId, Long serviceId) {
        return lookup(rosterCache, rosterKey(tenantId, serviceId));
    }

    @Override
    public void saveRoster(String tenantId, Long serviceId, List<MatchedStaff> roster) {
        rosterCache.put(rosterKey(tenantId, serviceId), List.copyOf(roster));
    }

    @Override
    public Optional<StaffMember> findStaff(Long staffId) {
        return lookup(staffCache, STAFF_PREFIX + staffId);
    }

    @Override
    public void saveStaff(StaffMember staff) {
        staffCache.put(STAFF_PREFIX + staff.id(), staff);
    }

    @Override
    public void evictSlots(String tenantId, Long staffId, LocalDate date) {
        String prefix = SLOTS_PREFIX + tenantId + ":" + staffId + ":" + date + ":";
        slotGeneration.incrementAndGet();
        slotCache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.debug("Slot cache evicted: tenantId={}, staffId={}, date={}", tenantId, staffId, date);
    }

    @Override
    public void invalidateStaff(String tenantId, Long staffId) {
        String rosterPrefix = ROSTER_PREFIX + tenantId + ":";
        rosterCache.asMap().keySet().removeIf(key -> key.startsWith(rosterPrefix));

        if (staffId != null) {
            staffCache.invalidate(STAFF_PREFIX + staffId);
            slotGeneration.incrementAndGet();
            String slotPrefix = SLOTS_PREFIX + tenantId + ":" + staffId + ":";
            slotCache.asMap().keySet().removeIf(key -> key.startsWith(slotPrefix));
        }
        log.debug("Staff cache invalidated: tenantId={}, staffId={}", tenantId, staffId);
    }

    @Override
    public void clear() {
        slotGeneration.incrementAndGet();
        slotCache.invalidateAll();
        rosterCache.invalidateAll();
        staffCache.invalidateAll();
    }

    @Override
    public Map<String, Long> estimatedSizes() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        sizes.put("slots", slotCache.estimatedSize());
        sizes.put("rosters", rosterCache.estimatedSize());
        sizes.put("staff", staffCache.estimatedSize());
        return sizes;
    }

    private <V> Optional<V> lookup(Cache<String, V> cache, String key) {
        try {
            V value = cache.getIfPresent(key);
            log.debug("Availability cache {}: key={}", value != null ? "HIT" : "MISS", key);
            return Optional.ofNullable(value);
        } catch (RuntimeException e) {
            log.warn("Availability cache error, treating as MISS: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static String slotKey(String tenantId, Long staffId, LocalDate date, int durationMinutes) {
        return SLOTS_PREFIX + tenantId + ":" + staffId + ":" + date + ":" + durationMinutes;
    }

    private static String rosterKey(String tenantId, Long serviceId) {
        return ROSTER_PREFIX + tenantId + ":" + serviceId;
    }
}
