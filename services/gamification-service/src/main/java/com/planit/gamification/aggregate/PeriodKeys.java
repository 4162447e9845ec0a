package com.planit.gamification.aggregate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Derives monthly leaderboard period keys ("yyyy-MM").
 *
 * <p>All clients must agree on the zone, otherwise one calendar month splits into two
 * leaderboard segments around midnight of the first.
 */
public class PeriodKeys {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ZoneId zone;
    private final Clock clock;

    public PeriodKeys(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    public String periodKey(Instant instant) {
        return MONTH.format(instant.atZone(zone));
    }

    public String currentPeriodKey() {
        return periodKey(clock.instant());
    }

    public ZoneId getZone() {
        return zone;
    }
}
