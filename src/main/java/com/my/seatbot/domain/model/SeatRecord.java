package com.my.seatbot.domain.model;

/**
 * One row of a scrape result. Seats and dates are kept as the page printed them.
 */
public record SeatRecord(String topic,
                         String format,
                         String university,
                         String region,
                         String city,
                         String seats,
                         String date,
                         String deadline) {
}
