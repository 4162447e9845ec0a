package com.planit.gamification.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to credit XP. A caller that retries an award after an unclear outcome must reuse
 * the same {@code eventId}; when absent one is generated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AwardCommand {

    private String userId;

    private int amount;

    private String eventKind;

    private String subjectRef;

    private String details;

    private String eventId;
}
