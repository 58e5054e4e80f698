package com.my.seatbot.domain.model;

import java.time.OffsetDateTime;

/**
 * A donation a recipient says they made, waiting for (or past) admin review.
 */
public record DonationClaim(String chatId,
                            Long userId,
                            String username,
                            String firstName,
                            String lastName,
                            String reference,
                            OffsetDateTime submittedAt,
                            boolean verified) {

    public static DonationClaim submitted(String chatId, ChatUser profile, String reference, OffsetDateTime at) {
        return new DonationClaim(chatId, profile.id(), profile.username(), profile.firstName(), profile.lastName(),
                reference, at, false);
    }

    public DonationClaim withVerified(boolean value) {
        return new DonationClaim(chatId, userId, username, firstName, lastName, reference, submittedAt, value);
    }

    public String displayName() {
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return name.isEmpty() ? "Unknown" : name;
    }
}
