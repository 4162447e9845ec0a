package com.planit.gamification.ledger;

import com.planit.gamification.domain.UserProfile;
import com.planit.gamification.domain.UserXpState;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Everything one read of {@code users/{userId}} yields.
 */
@Getter
@AllArgsConstructor
public class LedgerRecord {

    private final UserXpState state;

    private final UserProfile profile;
}
