package com.my.seatbot.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable runtime settings handed to the domain services at construction time.
 */
public record NotifierSettings(String adminChatId,
                               List<String> topics,
                               Map<String, String> topicGroups,
                               String premiumGroup,
                               String bookingUrl,
                               String donationAddress,
                               String repositoryUrl,
                               boolean directAlerts,
                               Duration messageDelay,
                               Duration reviewSessionTtl) {

    public NotifierSettings {
        adminChatId = blankToNull(adminChatId);
        premiumGroup = blankToNull(premiumGroup);
        donationAddress = donationAddress == null ? "" : donationAddress.trim();
        repositoryUrl = repositoryUrl == null ? "" : repositoryUrl;
        topics = topics.stream().sorted().toList();
        topicGroups = Map.copyOf(topicGroups);
    }

    public Optional<String> destinationFor(String topic) {
        return Optional.ofNullable(blankToNull(topicGroups.get(topic)));
    }

    public Optional<String> premiumDestination() {
        return Optional.ofNullable(premiumGroup);
    }

    public Optional<String> admin() {
        return Optional.ofNullable(adminChatId);
    }

    public boolean isAdmin(String chatId) {
        return adminChatId != null && adminChatId.equals(chatId);
    }

    public boolean isPremiumDestination(String chatId) {
        return premiumGroup != null && premiumGroup.equals(chatId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
