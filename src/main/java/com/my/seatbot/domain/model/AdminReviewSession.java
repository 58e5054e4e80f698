package com.my.seatbot.domain.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * In-memory state of one admin walking through pending donation claims.
 *
 * <p>{@code pending} is a snapshot taken when the session opened and is not refreshed.
 */
public record AdminReviewSession(String adminChatId,
                                 ReviewStep step,
                                 List<DonationClaim> pending,
                                 DonationClaim selected,
                                 OffsetDateTime expiresAt) {

    public AdminReviewSession {
        Objects.requireNonNull(adminChatId, "adminChatId");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(expiresAt, "expiresAt");
        pending = List.copyOf(pending);
    }

    public static AdminReviewSession open(String adminChatId, List<DonationClaim> pending, OffsetDateTime expiresAt) {
        return new AdminReviewSession(adminChatId, ReviewStep.SELECT, pending, null, expiresAt);
    }

    public AdminReviewSession select(DonationClaim claim) {
        return new AdminReviewSession(adminChatId, ReviewStep.ACTION, pending, claim, expiresAt);
    }

    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }
}
