package com.planit.gamification.dto;

import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.domain.XpEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class XpStateResponse {

    private String userId;
    private long xp;
    private int level;
    private long xpToNextLevel;
    private double progressToNextLevel;
    private long weeklyXp;
    private Instant lastUpdate;
    private List<XpEvent> recentEvents;

    public static XpStateResponse from(UserXpState state, List<XpEvent> recentEvents) {
        return XpStateResponse.builder()
                .userId(state.getUserId())
                .xp(state.getCurrentXp())
                .level(state.getLevel())
                .xpToNextLevel(state.xpToNextLevel())
                .progressToNextLevel(state.progressToNextLevel())
                .weeklyXp(state.getWeeklyXp())
                .lastUpdate(state.getLastUpdate())
                .recentEvents(recentEvents)
                .build();
    }
}
