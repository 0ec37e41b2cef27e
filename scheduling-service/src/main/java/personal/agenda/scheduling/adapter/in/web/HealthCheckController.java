package personal.agenda.scheduling.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.agenda.common.dto.ApiResponse;
import personal.agenda.common.health.HealthCheckService;
import personal.agenda.scheduling.adapter.in.web.dto.HealthCheckResponse;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Health Check API Controller
 * 데이터베이스 연결 상태와 가용성 캐시 현황을 제공합니다.
 * 캐시는 프로세스 내부 저장소라 상태 판정에는 포함하지 않는다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final AvailabilityCacheRepository availabilityCache;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, availabilityCache.estimatedSizes());

        if (healthCheckService.isHealthy(Map.of("database", databaseStatus))) {
            return ResponseEntity.ok(ApiResponse.success("Scheduling service is healthy", data));
        }
        log.warn("Health check degraded: database={}", databaseStatus);
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
