package com.my.seatbot.domain.port.out;

import java.time.OffsetDateTime;

/**
 * Current time source, injectable so tests can move time forward.
 */
public interface ClockPort {
    OffsetDateTime now();
}
