package com.planit.gamification.exception;

import org.springframework.http.HttpStatus;

/**
 * Award amount was zero or negative. Raised before any store access.
 */
public class InvalidXpAmountException extends GamificationException {

    private final int amount;

    public InvalidXpAmountException(int amount) {
        super("INVALID_XP_AMOUNT", "XP award amount must be positive but was " + amount,
                HttpStatus.BAD_REQUEST, null);
        this.amount = amount;
    }

    public int getAmount() {
        return amount;
    }
}
