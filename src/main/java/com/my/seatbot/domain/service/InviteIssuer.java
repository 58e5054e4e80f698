package com.my.seatbot.domain.service;

import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Mints a fresh single-use invite per request. Links are never cached or shared.
 */
public class InviteIssuer {

    private static final Logger log = Logger.getLogger(InviteIssuer.class);

    static final Duration LINK_LIFETIME = Duration.ofSeconds(60);
    static final int MEMBER_LIMIT = 1;

    private final TelegramSendPort telegramSendPort;
    private final ClockPort clockPort;

    public InviteIssuer(TelegramSendPort telegramSendPort, ClockPort clockPort) {
        this.telegramSendPort = telegramSendPort;
        this.clockPort = clockPort;
    }

    public Optional<String> issue(String destination) {
        long expireAt = clockPort.now().plus(LINK_LIFETIME).toEpochSecond();
        Optional<String> link = telegramSendPort.createInviteLink(destination, expireAt, MEMBER_LIMIT);
        if (link.isEmpty()) {
            log.warnf("Could not create invite link for %s", destination);
        }
        return link;
    }
}
