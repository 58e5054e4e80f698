package com.my.seatbot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.seatbot.adapter.out.clock.OffsetClockAdapter;
import com.my.seatbot.adapter.out.persistence.InMemoryRecordStore;
import com.my.seatbot.adapter.out.persistence.JsonFileRecordStore;
import com.my.seatbot.domain.model.DonationClaim;
import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.port.in.HandleUpdateUseCase;
import com.my.seatbot.domain.port.in.NotifyAvailabilityUseCase;
import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.DelayPort;
import com.my.seatbot.domain.port.out.RecordStore;
import com.my.seatbot.domain.port.out.StargazerPort;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.domain.port.out.TelegramUpdatePort;
import com.my.seatbot.domain.port.out.TranslationPort;
import com.my.seatbot.domain.service.AdminReviewConversation;
import com.my.seatbot.domain.service.DonationRegistry;
import com.my.seatbot.domain.service.InviteIssuer;
import com.my.seatbot.domain.service.MembershipEnforcer;
import com.my.seatbot.domain.service.NotificationFanoutService;
import com.my.seatbot.domain.service.StarVerificationService;
import com.my.seatbot.domain.service.SubscriberRegistry;
import com.my.seatbot.domain.service.TelegramUpdateService;
import com.my.seatbot.domain.service.UpdateDispatcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Why: domain services stay plain classes; this is the only place that picks their adapters.
 */
@ApplicationScoped
public class DomainConfig {

    private static final Logger log = Logger.getLogger(DomainConfig.class);

    static final String MEMORY_BACKEND = "memory";

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.inZone(appConfig.clock().zone());
    }

    @Produces
    @ApplicationScoped
    public NotifierSettings notifierSettings(AppConfig appConfig) {
        return settingsFrom(appConfig);
    }

    static NotifierSettings settingsFrom(AppConfig appConfig) {
        AppConfig.TelegramConfig telegram = appConfig.telegram();
        AppConfig.TopicsConfig topics = appConfig.topics();
        return new NotifierSettings(
                telegram.adminChatId().orElse(null),
                topics.keys(),
                topics.groups(),
                topics.premiumGroup().orElse(null),
                topics.bookingUrl(),
                appConfig.donation().address().orElse(null),
                "https://github.com/" + appConfig.github().repoOwner() + "/" + appConfig.github().repoName(),
                telegram.directAlerts(),
                Duration.ofMillis(telegram.messageDelayMillis()),
                Duration.ofMinutes(appConfig.review().sessionTtlMinutes()));
    }

    @Produces
    @ApplicationScoped
    public SubscriberRegistry subscriberRegistry(AppConfig appConfig, ObjectMapper objectMapper, ClockPort clockPort) {
        RecordStore<Subscriber> store = isMemoryBackend(appConfig)
                ? new InMemoryRecordStore<>()
                : JsonFileRecordStore.subscribers(Path.of(appConfig.storage().subscribersPath()), objectMapper);
        SubscriberRegistry registry = new SubscriberRegistry(store, clockPort);
        log.infof("Loaded %d subscribers (%s backend)", registry.listAll().size(), appConfig.storage().backend());
        return registry;
    }

    @Produces
    @ApplicationScoped
    public DonationRegistry donationRegistry(AppConfig appConfig, ObjectMapper objectMapper, ClockPort clockPort) {
        RecordStore<DonationClaim> store = isMemoryBackend(appConfig)
                ? new InMemoryRecordStore<>()
                : JsonFileRecordStore.donations(Path.of(appConfig.storage().donationsPath()), objectMapper);
        return new DonationRegistry(store, clockPort);
    }

    @Produces
    @ApplicationScoped
    public StarVerificationService starVerificationService(StargazerPort stargazerPort,
                                                           ClockPort clockPort,
                                                           AppConfig appConfig) {
        return new StarVerificationService(stargazerPort, clockPort,
                Duration.ofSeconds(appConfig.github().cacheTtlSeconds()), appConfig.github().pageSize());
    }

    @Produces
    @ApplicationScoped
    public InviteIssuer inviteIssuer(TelegramSendPort telegramSendPort, ClockPort clockPort) {
        return new InviteIssuer(telegramSendPort, clockPort);
    }

    @Produces
    @ApplicationScoped
    public MembershipEnforcer membershipEnforcer(NotifierSettings settings,
                                                 SubscriberRegistry subscriberRegistry,
                                                 DonationRegistry donationRegistry,
                                                 TelegramSendPort telegramSendPort,
                                                 TranslationPort translationPort,
                                                 DelayPort delayPort) {
        return new MembershipEnforcer(settings, subscriberRegistry, donationRegistry, telegramSendPort,
                translationPort, delayPort);
    }

    @Produces
    @ApplicationScoped
    public AdminReviewConversation adminReviewConversation(NotifierSettings settings,
                                                           DonationRegistry donationRegistry,
                                                           InviteIssuer inviteIssuer,
                                                           TelegramSendPort telegramSendPort,
                                                           TranslationPort translationPort,
                                                           ClockPort clockPort) {
        return new AdminReviewConversation(settings, donationRegistry, inviteIssuer, telegramSendPort,
                translationPort, clockPort);
    }

    @Produces
    @ApplicationScoped
    public HandleUpdateUseCase handleUpdateUseCase(NotifierSettings settings,
                                                   SubscriberRegistry subscriberRegistry,
                                                   DonationRegistry donationRegistry,
                                                   StarVerificationService starVerificationService,
                                                   AdminReviewConversation adminReviewConversation,
                                                   MembershipEnforcer membershipEnforcer,
                                                   InviteIssuer inviteIssuer,
                                                   TelegramSendPort telegramSendPort,
                                                   TranslationPort translationPort) {
        return new UpdateDispatcher(settings, subscriberRegistry, donationRegistry, starVerificationService,
                adminReviewConversation, membershipEnforcer, inviteIssuer, telegramSendPort, translationPort);
    }

    @Produces
    @ApplicationScoped
    public NotifyAvailabilityUseCase notifyAvailabilityUseCase(NotifierSettings settings,
                                                               SubscriberRegistry subscriberRegistry,
                                                               TelegramSendPort telegramSendPort,
                                                               TranslationPort translationPort,
                                                               ClockPort clockPort,
                                                               DelayPort delayPort) {
        return new NotificationFanoutService(settings, subscriberRegistry, telegramSendPort, translationPort,
                clockPort, delayPort);
    }

    @Produces
    @ApplicationScoped
    public TelegramUpdateService telegramUpdateService(TelegramUpdatePort telegramUpdatePort,
                                                       HandleUpdateUseCase handleUpdateUseCase) {
        return new TelegramUpdateService(telegramUpdatePort, handleUpdateUseCase);
    }

    private static boolean isMemoryBackend(AppConfig appConfig) {
        return MEMORY_BACKEND.equalsIgnoreCase(appConfig.storage().backend());
    }
}
