package com.my.seatbot.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.my.seatbot.domain.model.DonationClaim;

import java.time.OffsetDateTime;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
record DonationClaimDocument(@JsonProperty("chat_id") String chatId,
                             @JsonProperty("user_id") Long userId,
                             @JsonProperty("username") String username,
                             @JsonProperty("first_name") String firstName,
                             @JsonProperty("last_name") String lastName,
                             @JsonProperty("transaction_id") String reference,
                             @JsonProperty("submitted_at") OffsetDateTime submittedAt,
                             @JsonProperty("verified") boolean verified) implements KeyedDocument {

    static DonationClaimDocument from(DonationClaim claim) {
        return new DonationClaimDocument(claim.chatId(), claim.userId(), claim.username(), claim.firstName(),
                claim.lastName(), claim.reference(), claim.submittedAt(), claim.verified());
    }

    DonationClaim toDomain() {
        return new DonationClaim(chatId, userId, username, firstName, lastName, reference, submittedAt, verified);
    }
}
