package com.planit.gamification.event;

import com.planit.gamification.domain.Milestone;
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
public class MilestoneReachedEvent extends GamificationEvent {

    private Milestone milestone;

    @Override
    public String getEventType() {
        return "MILESTONE_REACHED";
    }
}
