package com.my.seatbot.domain.service;

import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InviteIssuerTest {

    @Test
    void every_request_mints_its_own_single_use_link() {
        TelegramSendPort sendPort = mock(TelegramSendPort.class);
        MutableClock clock = new MutableClock();
        long expiry = clock.now().toEpochSecond() + 60;
        when(sendPort.createInviteLink("-100111", expiry, 1))
                .thenReturn(Optional.of("https://t.me/+a"), Optional.of("https://t.me/+b"));
        InviteIssuer issuer = new InviteIssuer(sendPort, clock);

        assertThat(issuer.issue("-100111")).contains("https://t.me/+a");
        assertThat(issuer.issue("-100111")).contains("https://t.me/+b");
        verify(sendPort, times(2)).createInviteLink("-100111", expiry, 1);
    }
}
