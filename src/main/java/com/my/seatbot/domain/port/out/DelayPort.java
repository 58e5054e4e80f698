package com.my.seatbot.domain.port.out;

import java.time.Duration;

/**
 * Blocks the calling thread. Used for send pacing and retry backoff.
 */
public interface DelayPort {
    void pause(Duration duration);
}
