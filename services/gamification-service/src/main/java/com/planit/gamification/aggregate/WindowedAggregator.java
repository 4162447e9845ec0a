package com.planit.gamification.aggregate;

import com.planit.gamification.domain.XpEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rolling-window sums over a ledger history. Pure; never touches the store.
 */
public class WindowedAggregator {

    public static final Duration WEEK = Duration.ofDays(7);

    private final Duration weeklyWindow;

    public WindowedAggregator() {
        this(WEEK);
    }

    public WindowedAggregator(Duration weeklyWindow) {
        this.weeklyWindow = weeklyWindow;
    }

    /**
     * Sum of event amounts strictly younger than the window. An event exactly one window
     * old has left it.
     */
    public long weeklyXp(List<XpEvent> history, Instant now) {
        return sumSince(history, now.minus(weeklyWindow));
    }

    public long sumSince(List<XpEvent> history, Instant windowStartExclusive) {
        return history.stream()
                .filter(event -> event.isWithin(windowStartExclusive))
                .mapToLong(XpEvent::getXpAmount)
                .sum();
    }

    /**
     * First {@code limit} events of a newest-first history.
     */
    public List<XpEvent> recent(List<XpEvent> history, int limit) {
        return history.stream().limit(Math.max(0, limit)).toList();
    }
}
