package com.my.seatbot.domain.model;

/**
 * Profile snapshot of a platform account as it appeared on an inbound update.
 */
public record ChatUser(long id, String username, String firstName, String lastName, boolean bot) {

    public ChatUser {
        username = username == null ? "" : username;
        firstName = firstName == null ? "" : firstName;
        lastName = lastName == null ? "" : lastName;
    }

    public String displayName() {
        String name = (firstName + " " + lastName).trim();
        return name.isEmpty() ? "Unknown" : name;
    }
}
