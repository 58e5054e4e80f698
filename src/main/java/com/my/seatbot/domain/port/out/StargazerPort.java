package com.my.seatbot.domain.port.out;

import java.util.List;

/**
 * Paged listing of accounts that starred the tracked repository.
 */
public interface StargazerPort {

    /**
     * @param page 1-based page number
     * @return logins on that page, fewer than {@code perPage} on the last one
     * @throws com.my.seatbot.domain.exception.StargazerFetchException when the page cannot be read
     */
    List<String> fetchPage(int page, int perPage);
}
