package com.my.seatbot.domain.model;

/**
 * Outcome of storing a verified external identity on a subscriber.
 */
public enum IdentityClaimResult {
    VERIFIED,
    ALREADY_CLAIMED,
    NOT_SUBSCRIBED
}
