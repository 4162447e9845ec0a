package com.planit.gamification.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Profile fields written by onboarding onto the user document and copied into
 * leaderboard entries. Read-only for this service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    private String username;

    private String displayName;

    private String photoUrl;

    public static UserProfile anonymous() {
        return new UserProfile("", "", null);
    }
}
