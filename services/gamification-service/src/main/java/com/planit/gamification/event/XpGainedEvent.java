package com.planit.gamification.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class XpGainedEvent extends GamificationEvent {

    private int amount;

    private String eventKind;

    @Override
    public String getEventType() {
        return "XP_GAINED";
    }
}
