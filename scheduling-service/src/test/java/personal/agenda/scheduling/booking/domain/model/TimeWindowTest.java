package personal.agenda.scheduling.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import personal.agenda.common.exception.BusinessException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static personal.agenda.scheduling.support.SchedulingFixtures.time;

@DisplayName("TimeWindow 테스트")
class TimeWindowTest {

    @ParameterizedTest(name = "start={0}, duration={1} -> {2}")
    @CsvSource({
            "09:00, 30, true",
            "23:29, 30, true",
            "23:30, 30, false",
            "00:00, 1440, false",
            "09:00, 0, false",
            "09:00, -30, false",
            "09:00, 2147483647, false",
            "22:00, 2147483647, false",
            "23:59, 2147483647, false"
    })
    @DisplayName("하루 안에 들어가는지 판정 (큰 소요 시간도 오버플로 없이 거부)")
    void fitsWithinDay(String start, int duration, boolean expected) {
        assertThat(TimeWindow.fitsWithinDay(time(start), duration)).isEqualTo(expected);
    }

    @Test
    @DisplayName("starting은 종료 시각을 시작 + 소요 시간으로 고정한다")
    void startingKeepsDuration() {
        TimeWindow window = TimeWindow.starting(time("10:00"), 45);

        assertThat(window.end()).isEqualTo(time("10:45"));
        assertThat(window.durationMinutes()).isEqualTo(45);
    }

    @Test
    @DisplayName("int 최대 소요 시간은 24시간으로 나머지 연산되지 않고 거부된다")
    void startingRejectsOverflowingDuration() {
        assertThatThrownBy(() -> TimeWindow.starting(time("09:00"), Integer.MAX_VALUE))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("does not fit within the day");
    }
}
