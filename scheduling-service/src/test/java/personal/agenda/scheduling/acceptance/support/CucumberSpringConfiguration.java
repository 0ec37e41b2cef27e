package personal.agenda.scheduling.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * H2 인메모리 DB와 수동 제어 캐시 시계로 전체 컨텍스트를 띄운다
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@ActiveProfiles("test")
@Import({TestCacheClockConfiguration.class, SchedulingTestAdapter.class})
public class CucumberSpringConfiguration {
}
