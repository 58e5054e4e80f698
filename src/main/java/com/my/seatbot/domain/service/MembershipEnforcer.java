package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.model.TelegramOutgoingMessage;
import com.my.seatbot.domain.port.out.DelayPort;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.domain.port.out.TranslationPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks every account that joins a group and removes the ones the group does not admit.
 * The premium group admits verified donators; every other group admits verified subscribers.
 */
public class MembershipEnforcer {

    private static final Logger log = Logger.getLogger(MembershipEnforcer.class);

    static final Duration NOTICE_DELAY = Duration.ofSeconds(1);

    private final NotifierSettings settings;
    private final SubscriberRegistry subscriberRegistry;
    private final DonationRegistry donationRegistry;
    private final TelegramSendPort telegramSendPort;
    private final TranslationPort translationPort;
    private final DelayPort delayPort;

    public MembershipEnforcer(NotifierSettings settings,
                              SubscriberRegistry subscriberRegistry,
                              DonationRegistry donationRegistry,
                              TelegramSendPort telegramSendPort,
                              TranslationPort translationPort,
                              DelayPort delayPort) {
        this.settings = settings;
        this.subscriberRegistry = subscriberRegistry;
        this.donationRegistry = donationRegistry;
        this.telegramSendPort = telegramSendPort;
        this.translationPort = translationPort;
        this.delayPort = delayPort;
    }

    public void onMembersJoined(String groupChatId, List<ChatUser> members) {
        boolean premiumGroup = settings.isPremiumDestination(groupChatId);
        for (ChatUser member : members) {
            if (member.bot()) {
                continue;
            }
            if (isAdmitted(premiumGroup, member)) {
                log.debugf("Admitted user %d to group %s", member.id(), groupChatId);
                continue;
            }
            String key = premiumGroup ? "premium_join_denied" : "join_denied";
            String notice = translationPort.t(key, Map.of(
                    "name", HtmlText.escape(member.displayName()),
                    "repo", settings.repositoryUrl()));
            telegramSendPort.send(new TelegramOutgoingMessage(groupChatId, notice));
            delayPort.pause(NOTICE_DELAY);
            telegramSendPort.evictButAllowRejoin(groupChatId, member.id());
            log.warnf("Removed unverified user %s (%d) from group %s", member.displayName(), member.id(), groupChatId);
        }
    }

    private boolean isAdmitted(boolean premiumGroup, ChatUser member) {
        Optional<Subscriber> subscriber = subscriberRegistry.findByUserId(member.id());
        if (subscriber.isEmpty()) {
            return false;
        }
        if (premiumGroup) {
            return donationRegistry.isVerified(subscriber.get().chatId());
        }
        return subscriber.get().verified();
    }
}
