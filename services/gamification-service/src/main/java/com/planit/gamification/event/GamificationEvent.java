package com.planit.gamification.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Base of the discrete signals the ledger emits for toast and animation collaborators.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public abstract class GamificationEvent {

    private String eventId;

    private String userId;

    private Instant timestamp;

    public abstract String getEventType();
}
