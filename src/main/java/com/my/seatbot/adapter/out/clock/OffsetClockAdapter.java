package com.my.seatbot.adapter.out.clock;

import com.my.seatbot.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Why: time comes through a port so tests can move it, and every timestamp carries the offset
 * of the configured zone.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter inZone(String zone) {
        return new OffsetClockAdapter(ZoneId.of(zone));
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
