package com.my.seatbot.domain.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Per-recipient subscription state, keyed by chat id.
 *
 * <p>Exam preferences: an empty list means no alerts, {@value #ALL_TOPICS} means every topic,
 * anything else is an explicit list of topic codes.
 */
public record Subscriber(String chatId,
                         Long userId,
                         String username,
                         String firstName,
                         String lastName,
                         OffsetDateTime joinedAt,
                         boolean active,
                         List<String> exams,
                         boolean verified,
                         String githubUsername,
                         Integer intervalMinutes) {

    public static final String ALL_TOPICS = "ALL";

    public Subscriber {
        exams = exams == null ? List.of() : List.copyOf(exams);
    }

    public static Subscriber newcomer(String chatId, ChatUser profile, OffsetDateTime joinedAt) {
        return new Subscriber(chatId, profile.id(), profile.username(), profile.firstName(), profile.lastName(),
                joinedAt, true, List.of(), false, null, null);
    }

    public Subscriber reactivate(ChatUser profile) {
        return new Subscriber(chatId, profile.id(), profile.username(), profile.firstName(), profile.lastName(),
                joinedAt, true, exams, verified, githubUsername, intervalMinutes);
    }

    public Subscriber withActive(boolean value) {
        return new Subscriber(chatId, userId, username, firstName, lastName, joinedAt, value, exams, verified,
                githubUsername, intervalMinutes);
    }

    public Subscriber withExams(List<String> value) {
        return new Subscriber(chatId, userId, username, firstName, lastName, joinedAt, active, value, verified,
                githubUsername, intervalMinutes);
    }

    public Subscriber withVerifiedIdentity(String identity) {
        return new Subscriber(chatId, userId, username, firstName, lastName, joinedAt, active, exams, true,
                identity, intervalMinutes);
    }

    public Subscriber withIntervalMinutes(Integer value) {
        return new Subscriber(chatId, userId, username, firstName, lastName, joinedAt, active, exams, verified,
                githubUsername, value);
    }

    public boolean isVerifiedAndActive() {
        return active && verified;
    }

    public boolean holdsIdentity(String identity) {
        return verified && githubUsername != null && identity != null
                && githubUsername.toLowerCase(Locale.ROOT).equals(identity.toLowerCase(Locale.ROOT));
    }

    public boolean wantsTopic(String topic) {
        if (!active || exams.isEmpty()) {
            return false;
        }
        return exams.contains(ALL_TOPICS) || exams.contains(topic);
    }

    public String displayName() {
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return name.isEmpty() ? "Unknown" : name;
    }
}
