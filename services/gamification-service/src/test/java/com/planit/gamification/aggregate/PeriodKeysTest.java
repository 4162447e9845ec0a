package com.planit.gamification.aggregate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PeriodKeys Tests")
class PeriodKeysTest {

    private static final Instant NEW_YEAR_UTC = Instant.parse("2025-01-01T02:30:00Z");

    @Test
    @DisplayName("Should format the month of the canonical zone")
    void shouldFormatMonth() {
        PeriodKeys keys = new PeriodKeys(ZoneOffset.UTC, Clock.fixed(NEW_YEAR_UTC, ZoneOffset.UTC));

        assertThat(keys.currentPeriodKey()).isEqualTo("2025-01");
        assertThat(keys.periodKey(Instant.parse("2024-12-31T23:59:59Z"))).isEqualTo("2024-12");
    }

    @Test
    @DisplayName("Should ignore the clock's zone so every client agrees")
    void shouldUseConfiguredZoneNotClockZone() {
        Clock newYork = Clock.fixed(NEW_YEAR_UTC, ZoneId.of("America/New_York"));

        assertThat(new PeriodKeys(ZoneOffset.UTC, newYork).currentPeriodKey()).isEqualTo("2025-01");
        assertThat(new PeriodKeys(ZoneId.of("America/New_York"), newYork).currentPeriodKey()).isEqualTo("2024-12");
    }
}
