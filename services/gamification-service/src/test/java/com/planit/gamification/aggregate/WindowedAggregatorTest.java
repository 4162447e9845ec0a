package com.planit.gamification.aggregate;

import com.planit.gamification.domain.XpEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WindowedAggregator Tests")
class WindowedAggregatorTest {

    private static final Instant NOW = Instant.parse("2025-03-15T12:00:00Z");

    private final WindowedAggregator aggregator = new WindowedAggregator();

    @Test
    @DisplayName("Should exclude an event exactly seven days old")
    void shouldExcludeEventAtWindowBoundary() {
        List<XpEvent> history = List.of(event("a", 50, NOW.minus(Duration.ofDays(7))));

        assertThat(aggregator.weeklyXp(history, NOW)).isZero();
    }

    @Test
    @DisplayName("Should include an event just inside the window")
    void shouldIncludeEventInsideWindow() {
        Instant almostWeekOld = NOW.minus(Duration.ofDays(6).plusHours(23).plusMinutes(59));
        List<XpEvent> history = List.of(
                event("a", 50, almostWeekOld),
                event("b", 200, NOW.minus(Duration.ofDays(8))));

        assertThat(aggregator.weeklyXp(history, NOW)).isEqualTo(50);
    }

    @Test
    @DisplayName("Should sum every event in the window")
    void shouldSumEventsInWindow() {
        List<XpEvent> history = List.of(
                event("c", 15, NOW.minusSeconds(60)),
                event("b", 200, NOW.minus(Duration.ofDays(2))),
                event("a", 75, NOW.minus(Duration.ofDays(30))));

        assertThat(aggregator.weeklyXp(history, NOW)).isEqualTo(215);
    }

    @Test
    @DisplayName("Should ignore events without a timestamp")
    void shouldIgnoreUntimedEvents() {
        List<XpEvent> history = List.of(event("a", 50, null), event("b", 25, NOW));

        assertThat(aggregator.weeklyXp(history, NOW)).isEqualTo(25);
    }

    @Test
    @DisplayName("Should return the newest events first up to the limit")
    void shouldReturnRecentEvents() {
        List<XpEvent> history = List.of(
                event("c", 15, NOW),
                event("b", 30, NOW.minusSeconds(10)),
                event("a", 50, NOW.minusSeconds(20)));

        assertThat(aggregator.recent(history, 2)).extracting(XpEvent::getId).containsExactly("c", "b");
        assertThat(aggregator.recent(history, 10)).hasSize(3);
        assertThat(aggregator.recent(history, 0)).isEmpty();
    }

    private static XpEvent event(String id, int amount, Instant timestamp) {
        return XpEvent.builder().id(id).eventKind("Visited Place").xpAmount(amount).timestamp(timestamp).build();
    }
}
