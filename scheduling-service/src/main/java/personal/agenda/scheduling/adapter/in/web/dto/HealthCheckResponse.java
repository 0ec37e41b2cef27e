package personal.agenda.scheduling.adapter.in.web.dto;

import java.util.Map;

/**
 * Health Check 응답 데이터
 *
 * @param database        데이터베이스 상태 ("UP" / "DOWN")
 * @param availabilityCache 가용성 캐시별 추정 항목 수
 */
public record HealthCheckResponse(
        String database,
        Map<String, Long> availabilityCache
) {
}
