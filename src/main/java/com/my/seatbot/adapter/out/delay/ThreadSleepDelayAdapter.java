package com.my.seatbot.adapter.out.delay;

import com.my.seatbot.domain.port.out.DelayPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;

/**
 * Why: pacing and backoff sleeps go through a port so tests record them instead of waiting.
 */
@ApplicationScoped
public class ThreadSleepDelayAdapter implements DelayPort {

    @Override
    public void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
