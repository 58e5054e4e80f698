package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.DonationClaim;
import com.my.seatbot.domain.model.IdentityClaimResult;
import com.my.seatbot.domain.model.IncomingUpdate;
import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.model.TelegramOutgoingMessage;
import com.my.seatbot.domain.port.in.HandleUpdateUseCase;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.domain.port.out.TranslationPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes inbound updates. First match wins:
 * <ol>
 *     <li>group membership changes go to the {@link MembershipEnforcer}</li>
 *     <li>anything but private text is ignored</li>
 *     <li>the admin's messages go to an open {@link AdminReviewConversation}</li>
 *     <li>start, donate and identity commands, open to everyone</li>
 *     <li>admin-only commands</li>
 *     <li>the verification gate</li>
 *     <li>commands for verified subscribers, then free-text topic selection</li>
 * </ol>
 */
public class UpdateDispatcher implements HandleUpdateUseCase {

    private static final Logger log = Logger.getLogger(UpdateDispatcher.class);

    static final int MAX_REFERENCE_LENGTH = 128;
    private static final ChatUser ANONYMOUS = new ChatUser(0L, "", "", "", false);
    static final int MIN_INTERVAL_MINUTES = 1;
    static final int MAX_INTERVAL_MINUTES = 60;

    private final NotifierSettings settings;
    private final SubscriberRegistry subscriberRegistry;
    private final DonationRegistry donationRegistry;
    private final StarVerificationService starVerificationService;
    private final AdminReviewConversation adminReviewConversation;
    private final MembershipEnforcer membershipEnforcer;
    private final InviteIssuer inviteIssuer;
    private final TelegramSendPort telegramSendPort;
    private final TranslationPort translationPort;

    public UpdateDispatcher(NotifierSettings settings,
                            SubscriberRegistry subscriberRegistry,
                            DonationRegistry donationRegistry,
                            StarVerificationService starVerificationService,
                            AdminReviewConversation adminReviewConversation,
                            MembershipEnforcer membershipEnforcer,
                            InviteIssuer inviteIssuer,
                            TelegramSendPort telegramSendPort,
                            TranslationPort translationPort) {
        this.settings = settings;
        this.subscriberRegistry = subscriberRegistry;
        this.donationRegistry = donationRegistry;
        this.starVerificationService = starVerificationService;
        this.adminReviewConversation = adminReviewConversation;
        this.membershipEnforcer = membershipEnforcer;
        this.inviteIssuer = inviteIssuer;
        this.telegramSendPort = telegramSendPort;
        this.translationPort = translationPort;
    }

    @Override
    public void handle(IncomingUpdate update) {
        MDC.put("updateId", update.updateId());
        MDC.put("chatId", update.chatId());
        try {
            route(update);
        } finally {
            MDC.remove("updateId");
            MDC.remove("chatId");
        }
    }

    private void route(IncomingUpdate update) {
        if (update.isGroupMembershipChange()) {
            membershipEnforcer.onMembersJoined(update.chatId(), update.newMembers());
            return;
        }
        if (!update.isPrivateText()) {
            return;
        }
        String chatId = update.chatId();
        String text = update.text().trim();
        if (text.isEmpty()) {
            return;
        }
        ChatUser sender = update.from() == null ? ANONYMOUS : update.from();

        if (settings.isAdmin(chatId) && adminReviewConversation.isOpen(chatId)) {
            adminReviewConversation.handle(chatId, text);
            return;
        }

        String[] parts = text.split("\\s+", 2);
        String command = commandName(parts[0]);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        switch (command) {
            case "/start", "/subscribe" -> {
                start(chatId, sender);
                return;
            }
            case "/donate" -> {
                if (argument.isEmpty()) {
                    donationInfo(chatId);
                } else {
                    submitDonation(chatId, sender, argument);
                }
                return;
            }
            case "/github", "/star" -> {
                if (argument.isEmpty()) {
                    reply(chatId, translationPort.t("github_usage"));
                } else {
                    verifyIdentity(chatId, sender, argument);
                }
                return;
            }
            default -> {
            }
        }

        if (settings.isAdmin(chatId) && handleAdminCommand(chatId, command, argument)) {
            return;
        }

        Optional<Subscriber> subscriber = subscriberRegistry.get(chatId);
        if (subscriber.isEmpty() || !subscriber.get().isVerifiedAndActive()) {
            reply(chatId, translationPort.t("github_required", Map.of("repo", settings.repositoryUrl())));
            return;
        }

        switch (command) {
            case "/stop", "/unsubscribe" -> stop(chatId);
            case "/exam", "/exams" -> topicMenu(chatId);
            case "/status" -> status(chatId, subscriber.get());
            case "/help" -> reply(chatId, translationPort.t("help_message"));
            case "/alerts" -> alerts(chatId, subscriber.get(), argument);
            default -> selectTopic(chatId, text);
        }
    }

    private boolean handleAdminCommand(String chatId, String command, String argument) {
        switch (command) {
            case "/interval" -> {
                if (argument.isEmpty()) {
                    reply(chatId, translationPort.t("interval_info"));
                } else {
                    setInterval(chatId, argument);
                }
                return true;
            }
            case "/donations" -> {
                adminReviewConversation.start(chatId);
                return true;
            }
            case "/stats" -> {
                stats(chatId);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private void start(String chatId, ChatUser sender) {
        boolean isNew = subscriberRegistry.subscribe(chatId, sender);
        reply(chatId, translationPort.t("bot_welcome", Map.of("repo", settings.repositoryUrl())));
        if (isNew) {
            log.infof("New subscriber: %s (@%s, id %d)", sender.displayName(), sender.username(), sender.id());
        }
    }

    private void stop(String chatId) {
        subscriberRegistry.unsubscribe(chatId);
        reply(chatId, translationPort.t("bot_stopped"));
    }

    private void donationInfo(String chatId) {
        reply(chatId, translationPort.t("donate_info", Map.of("address", settings.donationAddress())));
    }

    private void submitDonation(String chatId, ChatUser sender, String reference) {
        if (reference.length() > MAX_REFERENCE_LENGTH) {
            reply(chatId, translationPort.t("donate_invalid_ref", Map.of("max", MAX_REFERENCE_LENGTH)));
            return;
        }
        DonationClaim claim = donationRegistry.addClaim(chatId, sender, reference);
        String shownReference = HtmlText.escape(reference);
        reply(chatId, translationPort.t("donate_submitted", Map.of("tx_id", shownReference)));
        settings.admin().ifPresent(admin -> reply(admin, translationPort.t("donate_admin_notice", Map.of(
                "name", HtmlText.escape(claim.displayName()),
                "username", HtmlText.escape(sender.username().isEmpty() ? "N/A" : sender.username()),
                "chat_id", chatId,
                "tx_id", shownReference))));
        log.infof("Donation claim from %s (reference %s)", chatId, reference);
    }

    private void verifyIdentity(String chatId, ChatUser sender, String raw) {
        String identity = normalizeIdentity(raw);
        if (identity.isEmpty()) {
            reply(chatId, translationPort.t("github_usage"));
            return;
        }
        String shown = HtmlText.escape(identity);
        reply(chatId, translationPort.t("github_checking", Map.of("username", shown)));
        if (!starVerificationService.hasEndorsed(identity)) {
            reply(chatId, translationPort.t("github_not_starred",
                    Map.of("username", shown, "repo", settings.repositoryUrl())));
            return;
        }
        IdentityClaimResult result = subscriberRegistry.claimIdentity(chatId, sender, identity);
        switch (result) {
            case VERIFIED -> {
                reply(chatId, translationPort.t("github_verified", Map.of("username", shown)));
                log.infof("GitHub verified: %s -> %s", chatId, identity);
            }
            case ALREADY_CLAIMED -> {
                reply(chatId, translationPort.t("github_already_claimed", Map.of("username", shown)));
                log.warnf("GitHub identity %s already claimed, rejected for %s", identity, chatId);
            }
            case NOT_SUBSCRIBED -> reply(chatId, translationPort.t("bot_not_subscribed"));
        }
    }

    private void setInterval(String chatId, String argument) {
        int minutes;
        try {
            minutes = Integer.parseInt(argument.trim());
        } catch (NumberFormatException e) {
            reply(chatId, translationPort.t("interval_usage"));
            return;
        }
        if (minutes < MIN_INTERVAL_MINUTES || minutes > MAX_INTERVAL_MINUTES) {
            reply(chatId, translationPort.t("interval_range"));
            return;
        }
        if (!subscriberRegistry.setIntervalMinutes(chatId, minutes)) {
            reply(chatId, translationPort.t("bot_not_subscribed"));
            return;
        }
        reply(chatId, translationPort.t("interval_set", Map.of("minutes", minutes)));
    }

    private void stats(String chatId) {
        List<Subscriber> active = subscriberRegistry.listActive();
        long verified = active.stream().filter(Subscriber::verified).count();
        reply(chatId, translationPort.t("admin_stats", Map.of(
                "active", active.size(),
                "verified", verified,
                "pending", donationRegistry.listUnverified().size(),
                "premium", donationRegistry.listVerified().size(),
                "stars", starVerificationService.getEndorserCount())));
    }

    private void topicMenu(String chatId) {
        List<String> topics = settings.topics();
        StringBuilder text = new StringBuilder(translationPort.t("exam_select_prompt")).append("\n");
        for (int i = 0; i < topics.size(); i++) {
            text.append("\n").append(i + 1).append(". ").append(topics.get(i));
        }
        reply(chatId, text.toString());
    }

    private void status(String chatId, Subscriber subscriber) {
        String donation = donationRegistry.get(chatId)
                .map(claim -> claim.verified() ? translationPort.t("status_premium") : translationPort.t("status_pending"))
                .orElseGet(() -> translationPort.t("status_no_donation"));
        reply(chatId, translationPort.t("status_message", Map.of(
                "active", subscriber.active() ? "✅" : "❌",
                "github", HtmlText.escape(subscriber.githubUsername() == null ? "N/A" : subscriber.githubUsername()),
                "verified", subscriber.verified() ? "✅" : "❌",
                "donation", donation,
                "exams", describePreferences(subscriber.exams()))));
    }

    private void alerts(String chatId, Subscriber subscriber, String argument) {
        if (argument.isEmpty()) {
            reply(chatId, translationPort.t("alerts_current", Map.of("exams", describePreferences(subscriber.exams()))));
            return;
        }
        Optional<List<String>> selection = parsePreferences(argument);
        if (selection.isEmpty()) {
            reply(chatId, translationPort.t("alerts_invalid", Map.of("codes", String.join(", ", settings.topics()))));
            return;
        }
        subscriberRegistry.setPreferences(chatId, selection.get());
        reply(chatId, translationPort.t("alerts_updated", Map.of("exams", describePreferences(selection.get()))));
    }

    private Optional<List<String>> parsePreferences(String argument) {
        String[] tokens = argument.trim().split("[\\s,]+");
        if (tokens.length == 1 && Subscriber.ALL_TOPICS.equalsIgnoreCase(tokens[0])) {
            return Optional.of(List.of(Subscriber.ALL_TOPICS));
        }
        if (tokens.length == 1 && "none".equalsIgnoreCase(tokens[0])) {
            return Optional.of(List.of());
        }
        List<String> selected = new ArrayList<>();
        for (String token : tokens) {
            Optional<String> topic = matchTopicName(token);
            if (topic.isEmpty()) {
                return Optional.empty();
            }
            if (!selected.contains(topic.get())) {
                selected.add(topic.get());
            }
        }
        return Optional.of(selected);
    }

    private String describePreferences(List<String> exams) {
        if (exams.isEmpty()) {
            return translationPort.t("alerts_none");
        }
        if (exams.contains(Subscriber.ALL_TOPICS)) {
            return translationPort.t("alerts_all");
        }
        return String.join(", ", exams);
    }

    private void selectTopic(String chatId, String text) {
        Optional<String> topic = resolveTopic(text);
        if (topic.isEmpty()) {
            log.debugf("Ignoring unrecognised text from %s", chatId);
            return;
        }
        sendInvite(chatId, topic.get());
    }

    Optional<String> resolveTopic(String text) {
        List<String> topics = settings.topics();
        try {
            int index = Integer.parseInt(text.trim());
            if (index >= 1 && index <= topics.size()) {
                return Optional.of(topics.get(index - 1));
            }
            return Optional.empty();
        } catch (NumberFormatException e) {
            return matchTopicName(text);
        }
    }

    private Optional<String> matchTopicName(String text) {
        String wanted = text.trim().toUpperCase(Locale.ROOT);
        return settings.topics().stream()
                .filter(topic -> topic.toUpperCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    private void sendInvite(String chatId, String topic) {
        Optional<String> destination = settings.destinationFor(topic);
        if (destination.isEmpty()) {
            reply(chatId, translationPort.t("invite_group_missing", Map.of("exam", topic)));
            return;
        }
        reply(chatId, translationPort.t("invite_generating", Map.of("exam", topic)));
        inviteIssuer.issue(destination.get()).ifPresentOrElse(
                link -> {
                    reply(chatId, translationPort.t("invite_link", Map.of("exam", topic, "link", link)));
                    log.infof("Invite link sent to %s for %s", chatId, topic);
                },
                () -> reply(chatId, translationPort.t("invite_failed", Map.of("exam", topic))));
    }

    /**
     * Accepts {@code name}, {@code @name}, {@code name/} and profile URLs such as
     * {@code https://github.com/name}.
     */
    static String normalizeIdentity(String raw) {
        String value = raw.trim();
        while (value.startsWith("@")) {
            value = value.substring(1);
        }
        value = stripSlashes(value);
        if (value.contains("github.com/")) {
            String[] segments = value.split("/");
            value = segments[segments.length - 1];
        }
        return value.trim();
    }

    private static String stripSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

    private static String commandName(String token) {
        String command = token.toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (command.startsWith("/") && mention > 0) {
            command = command.substring(0, mention);
        }
        return command;
    }

    private void reply(String chatId, String text) {
        telegramSendPort.send(new TelegramOutgoingMessage(chatId, text));
    }
}
