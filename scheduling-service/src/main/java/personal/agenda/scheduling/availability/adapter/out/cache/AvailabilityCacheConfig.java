package personal.agenda.scheduling.availability.adapter.out.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Availability Cache Configuration
 * TTL 판정에 사용할 Ticker를 빈으로 노출 (테스트에서 시간 제어 가능)
 */
@Configuration
@EnableConfigurationProperties(AvailabilityCacheProperties.class)
public class AvailabilityCacheConfig {

    @Bean
    public Ticker availabilityCacheTicker() {
        return Ticker.systemTicker();
    }
}
