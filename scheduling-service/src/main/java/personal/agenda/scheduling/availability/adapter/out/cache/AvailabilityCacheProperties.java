package personal.agenda.scheduling.availability.adapter.out.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 가용성 캐시 설정
 *
 * @param slotTtl   슬롯 목록 TTL (기본 2분)
 * @param rosterTtl 직원 로스터/직원 정보 TTL (기본 5분)
 */
@ConfigurationProperties(prefix = "scheduling.availability.cache")
public record AvailabilityCacheProperties(Duration slotTtl, Duration rosterTtl) {

    public AvailabilityCacheProperties {
        slotTtl = slotTtl != null ? slotTtl : Duration.ofMinutes(2);
        rosterTtl = rosterTtl != null ? rosterTtl : Duration.ofMinutes(5);
    }
}
