package personal.agenda.common.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Health Check 공통 서비스
 * 컴포넌트별 상태를 "UP" / "DOWN" 문자열로 표현한다.
 */
@Slf4j
@Service
public class HealthCheckService {

    public static final String UP = "UP";
    public static final String DOWN = "DOWN";

    private static final int VALIDATION_TIMEOUT_SECONDS = 1;

    /**
     * 데이터베이스 연결 상태 확인
     *
     * @param dataSource 확인할 DataSource
     * @return 커넥션 검증에 성공하면 "UP", 실패하거나 예외가 나면 "DOWN"
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS) ? UP : DOWN;
        } catch (SQLException | RuntimeException e) {
            log.error("Database health check failed", e);
            return DOWN;
        }
    }

    /**
     * 모든 컴포넌트가 UP일 때만 정상
     */
    public boolean isHealthy(Map<String, String> componentStatuses) {
        return !componentStatuses.isEmpty()
                && componentStatuses.values().stream().allMatch(UP::equals);
    }
}
