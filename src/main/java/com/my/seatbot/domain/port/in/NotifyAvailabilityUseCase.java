package com.my.seatbot.domain.port.in;

import com.my.seatbot.domain.model.SeatRecord;

import java.util.List;
import java.util.Map;

/**
 * Called by the scrape loop once per cycle, and by the admin test action.
 */
public interface NotifyAvailabilityUseCase {

    void sendAvailability(Map<String, List<SeatRecord>> resultsByTopic);

    void sendDailyDigest(Map<String, List<SeatRecord>> resultsByTopic, int windowHours);

    boolean testConnection();
}
