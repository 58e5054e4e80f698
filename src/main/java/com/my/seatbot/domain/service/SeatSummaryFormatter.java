package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.SeatRecord;
import com.my.seatbot.domain.port.out.TranslationPort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the one-message-per-topic availability summary, grouped by region and city.
 */
public class SeatSummaryFormatter {

    private final TranslationPort translationPort;
    private final String bookingUrl;

    public SeatSummaryFormatter(TranslationPort translationPort, String bookingUrl) {
        this.translationPort = translationPort;
        this.bookingUrl = bookingUrl;
    }

    public String format(String topic, List<SeatRecord> seats) {
        Map<Location, Tally> byLocation = new TreeMap<>(
                Comparator.comparing(Location::region).thenComparing(Location::city));
        for (SeatRecord seat : seats) {
            Location location = new Location(nullToEmpty(seat.region()), nullToEmpty(seat.city()));
            byLocation.computeIfAbsent(location, key -> new Tally()).add(seat);
        }

        List<String> lines = new ArrayList<>();
        lines.add("🚨 <b>" + HtmlText.escape(topic) + "</b>");
        lines.add("");
        String seatsLabel = translationPort.t("seats");
        String datesLabel = translationPort.t("dates");
        byLocation.forEach((location, tally) -> lines.add(
                "📍 <b>" + HtmlText.escape(orDash(location.region())) + "</b> – "
                        + HtmlText.escape(orDash(location.city())) + ": "
                        + tally.seats + " " + seatsLabel + ", "
                        + tally.dates.size() + " " + datesLabel));
        lines.add("");
        lines.add("🔗 <a href='" + bookingUrl + "'>📌 " + translationPort.t("book_now") + "</a>");
        return String.join("\n", lines);
    }

    /**
     * Seat counts the page printed as text; anything that is not a number counts as one seat.
     */
    static int seatCount(String seats) {
        if (seats == null) {
            return 0;
        }
        try {
            return Integer.parseInt(seats.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String orDash(String value) {
        return value.isEmpty() ? "-" : value;
    }

    private record Location(String region, String city) {
    }

    private static final class Tally {
        private int seats;
        private final Set<String> dates = new HashSet<>();

        void add(SeatRecord seat) {
            seats += seatCount(seat.seats());
            String date = nullToEmpty(seat.date()).trim();
            if (!date.isEmpty()) {
                dates.add(date);
            }
        }
    }
}
