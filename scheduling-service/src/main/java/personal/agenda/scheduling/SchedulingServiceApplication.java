package personal.agenda.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Scheduling Service Application
 * Staff, Catalog, Availability, Booking 도메인을 포함하는 예약 엔진 서비스
 */
@SpringBootApplication(
    scanBasePackages = {
        "personal.agenda.scheduling",
        "personal.agenda.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class SchedulingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedulingServiceApplication.class, args);
    }
}
