package com.planit.gamification.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Error-channel signal: the award identified by {@code awardEventId} was NOT recorded and
 * may be resubmitted with the same id.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AwardFailedEvent extends GamificationEvent {

    private String awardEventId;

    private int amount;

    private String eventKind;

    private String errorCode;

    private String reason;

    @Override
    public String getEventType() {
        return "AWARD_FAILED";
    }
}
