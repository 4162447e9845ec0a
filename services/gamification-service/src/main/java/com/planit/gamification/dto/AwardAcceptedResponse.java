package com.planit.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardAcceptedResponse {

    private String userId;

    /** Reuse this id to retry the award safely. */
    private String eventId;

    private String status;
}
