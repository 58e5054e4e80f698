package com.my.seatbot.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.my.seatbot.domain.model.Subscriber;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * On-disk shape of one subscriber entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
record SubscriberDocument(@JsonProperty("chat_id") String chatId,
                          @JsonProperty("user_id") Long userId,
                          @JsonProperty("username") String username,
                          @JsonProperty("first_name") String firstName,
                          @JsonProperty("last_name") String lastName,
                          @JsonProperty("joined_at") OffsetDateTime joinedAt,
                          @JsonProperty("active") boolean active,
                          @JsonProperty("exams") List<String> exams,
                          @JsonProperty("verified") boolean verified,
                          @JsonProperty("github_username") String githubUsername,
                          @JsonProperty("interval_minutes") Integer intervalMinutes) implements KeyedDocument {

    static SubscriberDocument from(Subscriber subscriber) {
        return new SubscriberDocument(subscriber.chatId(), subscriber.userId(), subscriber.username(),
                subscriber.firstName(), subscriber.lastName(), subscriber.joinedAt(), subscriber.active(),
                subscriber.exams(), subscriber.verified(), subscriber.githubUsername(), subscriber.intervalMinutes());
    }

    Subscriber toDomain() {
        return new Subscriber(chatId, userId, username, firstName, lastName, joinedAt, active, exams, verified,
                githubUsername, intervalMinutes);
    }
}
