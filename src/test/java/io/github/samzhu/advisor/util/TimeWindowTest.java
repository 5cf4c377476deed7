package io.github.samzhu.advisor.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class TimeWindowTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldEndAtCurrentTime() {
        // When
        TimeWindow window = TimeWindow.lastDays(CLOCK, 7);

        // Then
        assertThat(window.end()).isEqualTo(NOW);
        assertThat(window.start()).isEqualTo(Instant.parse("2026-02-22T12:00:00Z"));
        assertThat(window.days()).isEqualTo(7);
    }

    @Test
    void shouldScalePeriodValueToThirtyDays() {
        assertThat(TimeWindow.lastDays(CLOCK, 7).toMonthly(14.0)).isCloseTo(60.0, within(1e-9));
        assertThat(TimeWindow.lastDays(CLOCK, 30).toMonthly(14.0)).isCloseTo(14.0, within(1e-9));
    }

    @Test
    void shouldClampZeroDaysToOne() {
        // When
        TimeWindow window = TimeWindow.lastDays(CLOCK, 0);

        // Then
        assertThat(window.days()).isEqualTo(1);
        assertThat(window.toMonthly(2.0)).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void shouldCountHourWindowAsOneDay() {
        // When
        TimeWindow window = TimeWindow.lastHours(CLOCK, 24);

        // Then
        assertThat(window.start()).isEqualTo(Instant.parse("2026-02-28T12:00:00Z"));
        assertThat(window.days()).isEqualTo(1);
    }
}
