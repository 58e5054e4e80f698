package com.my.seatbot.support;

import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.NotifierSettings;
import com.my.seatbot.domain.model.SeatRecord;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public final class Fixtures {

    public static final String ADMIN = "900";
    public static final String PREMIUM_GROUP = "-100999";
    public static final String REPO = "https://github.com/acme/seats";

    private Fixtures() {
    }

    public static NotifierSettings settings(boolean directAlerts) {
        return new NotifierSettings(
                ADMIN,
                List.of("TOLC-I", "TOLC-E", "CEnT-S"),
                Map.of("TOLC-I", "-100111", "TOLC-E", "-100222"),
                PREMIUM_GROUP,
                "https://booking.example/login",
                "TXaddress",
                REPO,
                directAlerts,
                Duration.ofMillis(500),
                Duration.ofMinutes(15));
    }

    public static NotifierSettings settingsWithoutPremium() {
        return new NotifierSettings(ADMIN, List.of("TOLC-I"), Map.of("TOLC-I", "-100111"), null,
                "https://booking.example/login", "", REPO, false, Duration.ZERO, Duration.ofMinutes(15));
    }

    public static ChatUser user(long id, String username) {
        return new ChatUser(id, username, "Name" + id, "", false);
    }

    public static SeatRecord seat(String topic, String region, String city, String seats, String date) {
        return new SeatRecord(topic, "CASA", "Uni", region, city, seats, date, "01/03/2026");
    }
}
