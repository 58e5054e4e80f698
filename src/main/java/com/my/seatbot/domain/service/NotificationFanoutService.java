package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.SeatRecord;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.model.TelegramOutgoingMessage;
import com.my.seatbot.domain.port.in.NotifyAvailabilityUseCase;
import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.DelayPort;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.domain.port.out.TranslationPort;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a scrape result into paced outbound messages: one summary per topic to the topic group,
 * optionally the same summary to each subscriber who asked for the topic, and a daily
 * "nothing found" notice per empty topic.
 *
 * <p>The digest timestamps are kept in memory, so a restart sends the next digest right away.
 */
public class NotificationFanoutService implements NotifyAvailabilityUseCase {

    private static final Logger log = Logger.getLogger(NotificationFanoutService.class);

    private final NotifierSettings settings;
    private final SubscriberRegistry subscriberRegistry;
    private final TelegramSendPort telegramSendPort;
    private final TranslationPort translationPort;
    private final ClockPort clockPort;
    private final DelayPort delayPort;
    private final SeatSummaryFormatter formatter;
    // destination -> topic -> epoch seconds of the last digest
    private final Map<String, Map<String, Long>> lastDigestSent = new ConcurrentHashMap<>();

    public NotificationFanoutService(NotifierSettings settings,
                                     SubscriberRegistry subscriberRegistry,
                                     TelegramSendPort telegramSendPort,
                                     TranslationPort translationPort,
                                     ClockPort clockPort,
                                     DelayPort delayPort) {
        this.settings = settings;
        this.subscriberRegistry = subscriberRegistry;
        this.telegramSendPort = telegramSendPort;
        this.translationPort = translationPort;
        this.clockPort = clockPort;
        this.delayPort = delayPort;
        this.formatter = new SeatSummaryFormatter(translationPort, settings.bookingUrl());
    }

    @Override
    public void sendAvailability(Map<String, List<SeatRecord>> resultsByTopic) {
        resultsByTopic.forEach((topic, seats) -> {
            if (seats == null || seats.isEmpty()) {
                return;
            }
            String message = formatter.format(topic, seats);
            settings.destinationFor(topic).ifPresent(destination -> deliver(destination, message));
            if (settings.directAlerts()) {
                for (Subscriber subscriber : subscriberRegistry.listActive()) {
                    if (subscriber.verified() && subscriber.wantsTopic(topic)) {
                        deliver(subscriber.chatId(), message);
                    }
                }
            }
        });
    }

    @Override
    public void sendDailyDigest(Map<String, List<SeatRecord>> resultsByTopic, int windowHours) {
        long now = clockPort.now().toEpochSecond();
        long window = windowHours * 3600L;
        for (String topic : settings.topics()) {
            List<SeatRecord> seats = resultsByTopic.getOrDefault(topic, List.of());
            if (seats != null && !seats.isEmpty()) {
                continue;
            }
            settings.destinationFor(topic).ifPresent(destination -> {
                Map<String, Long> sentForDestination = lastDigestSent.computeIfAbsent(destination,
                        key -> new ConcurrentHashMap<>());
                Long last = sentForDestination.get(topic);
                if (last != null && now - last < window) {
                    return;
                }
                deliver(destination, translationPort.t("daily_no_spots", Map.of("exam", topic, "hours", windowHours)));
                sentForDestination.put(topic, now);
            });
        }
    }

    @Override
    public boolean testConnection() {
        return settings.admin()
                .map(admin -> telegramSendPort.send(new TelegramOutgoingMessage(admin,
                        "<b>SEAT BOT</b>\n\n" + translationPort.t("test_message"))))
                .orElseGet(() -> {
                    log.warn("Admin chat id is not configured, connection test skipped");
                    return false;
                });
    }

    private void deliver(String chatId, String text) {
        try {
            if (!telegramSendPort.send(new TelegramOutgoingMessage(chatId, text))) {
                log.warnf("Message to %s was not delivered", chatId);
            }
        } catch (RuntimeException e) {
            log.warnf("Message to %s failed: %s", chatId, e.getMessage());
        }
        delayPort.pause(settings.messageDelay());
    }
}
