package com.my.seatbot.support;

import com.my.seatbot.domain.port.out.ClockPort;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public class MutableClock implements ClockPort {

    private OffsetDateTime now;

    public MutableClock() {
        this(OffsetDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.ofHours(1)));
    }

    public MutableClock(OffsetDateTime start) {
        this.now = start;
    }

    @Override
    public OffsetDateTime now() {
        return now;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }
}
