package com.planit.gamification.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * One scoring entry of a user's XP ledger.
 *
 * <p>Created exactly once at award time and never mutated or deleted. The {@code id}
 * doubles as the idempotency key of the award that produced it.
 */
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class XpEvent {

    private final String id;

    /** Free-form label such as "Visited Place" or "Completed Mission". */
    private final String eventKind;

    private final int xpAmount;

    private final Instant timestamp;

    /** Place or mission the event refers to, if any. */
    private final String subjectRef;

    private final String details;

    public boolean isWithin(Instant windowStartExclusive) {
        return timestamp != null && timestamp.isAfter(windowStartExclusive);
    }

    public boolean hasId(String eventId) {
        return Objects.equals(id, eventId);
    }
}
