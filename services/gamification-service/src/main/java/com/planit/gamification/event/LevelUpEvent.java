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
public class LevelUpEvent extends GamificationEvent {

    private int newLevel;

    @Override
    public String getEventType() {
        return "LEVEL_UP";
    }
}
