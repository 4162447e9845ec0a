package com.planit.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankResponse {

    private String userId;
    private String periodKey;

    /** Null when the user is not on the top list. */
    private Integer rank;
}
