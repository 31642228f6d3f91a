package io.github.riemr.trainer.optimization.entity;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class DailyWindowTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Test
    void parse_acceptsPointAndRange() {
        DailyWindow point = DailyWindow.parse("9:00").orElseThrow();
        assertThat(point.isPoint()).isTrue();
        assertThat(point.from()).isEqualTo(LocalTime.of(9, 0));

        DailyWindow range = DailyWindow.parse(" 14:00 - 16:30 ").orElseThrow();
        assertThat(range.isPoint()).isFalse();
        assertThat(range.to()).isEqualTo(LocalTime.of(16, 30));
    }

    @Test
    void parse_returnsEmpty_forGarbageOrInvertedRange() {
        assertThat(DailyWindow.parse(null)).isEmpty();
        assertThat(DailyWindow.parse("")).isEmpty();
        assertThat(DailyWindow.parse("morning")).isEmpty();
        assertThat(DailyWindow.parse("10:00-09:00")).isEmpty();
        assertThat(DailyWindow.parse("25:00")).isEmpty();
    }

    @Test
    void on_widensPointByDuration() {
        TimeRange r = DailyWindow.parse("09:00").orElseThrow().on(DAY, 60);
        assertThat(r).isEqualTo(new TimeRange(DAY.atTime(9, 0), DAY.atTime(10, 0)));
    }

    @Test
    void touches_pointMatchesOnlyWhileSessionRuns() {
        DailyWindow noon = DailyWindow.parse("12:00").orElseThrow();
        assertThat(noon.touches(new TimeRange(DAY.atTime(11, 30), DAY.atTime(12, 30)))).isTrue();
        assertThat(noon.touches(new TimeRange(DAY.atTime(11, 0), DAY.atTime(12, 0)))).isFalse();
        assertThat(noon.touches(new TimeRange(DAY.atTime(12, 0), DAY.atTime(13, 0)))).isTrue();
    }

    @Test
    void touches_rangeUsesOverlap() {
        DailyWindow lunch = DailyWindow.parse("12:00-13:00").orElseThrow();
        assertThat(lunch.touches(new TimeRange(DAY.atTime(11, 0), DAY.atTime(12, 0)))).isFalse();
        assertThat(lunch.touches(new TimeRange(DAY.atTime(12, 45), DAY.atTime(13, 45)))).isTrue();
        assertThat(lunch.touches(new TimeRange(LocalDateTime.of(2024, 1, 16, 12, 0), LocalDateTime.of(2024, 1, 16, 12, 30))))
                .isTrue();
    }
}
