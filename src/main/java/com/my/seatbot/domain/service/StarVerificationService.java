package com.my.seatbot.domain.service;

import com.my.seatbot.domain.exception.StargazerFetchException;
import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.StargazerPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Answers whether an account starred the tracked repository, from a cached stargazer set that is
 * rebuilt at most once per TTL.
 */
public class StarVerificationService {

    private static final Logger log = Logger.getLogger(StarVerificationService.class);

    private final StargazerPort stargazerPort;
    private final ClockPort clockPort;
    private final Duration ttl;
    private final int pageSize;
    private final ReentrantLock lock = new ReentrantLock();

    private Set<String> stargazers = Set.of();
    private OffsetDateTime lastFetch;

    public StarVerificationService(StargazerPort stargazerPort, ClockPort clockPort, Duration ttl, int pageSize) {
        this.stargazerPort = stargazerPort;
        this.clockPort = clockPort;
        this.ttl = ttl;
        this.pageSize = pageSize;
    }

    public boolean hasEndorsed(String identity) {
        String normalized = normalize(identity);
        if (normalized.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            refreshIfStale();
            return stargazers.contains(normalized);
        } finally {
            lock.unlock();
        }
    }

    public int getEndorserCount() {
        lock.lock();
        try {
            refreshIfStale();
            return stargazers.size();
        } finally {
            lock.unlock();
        }
    }

    static String normalize(String identity) {
        if (identity == null) {
            return "";
        }
        String value = identity.trim();
        if (value.startsWith("@")) {
            value = value.substring(1);
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    // caller holds the lock
    private void refreshIfStale() {
        OffsetDateTime now = clockPort.now();
        if (lastFetch != null && !stargazers.isEmpty() && Duration.between(lastFetch, now).compareTo(ttl) < 0) {
            return;
        }
        Set<String> fetched = new HashSet<>();
        int page = 1;
        while (true) {
            List<String> logins;
            try {
                logins = stargazerPort.fetchPage(page, pageSize);
            } catch (StargazerFetchException e) {
                log.warnf("Stargazer listing stopped at page %d, keeping %d entries: %s", page, fetched.size(), e.getMessage());
                break;
            }
            for (String login : logins) {
                if (login != null && !login.isBlank()) {
                    fetched.add(login.toLowerCase(Locale.ROOT));
                }
            }
            if (logins.size() < pageSize) {
                break;
            }
            page++;
        }
        stargazers = Set.copyOf(fetched);
        lastFetch = now;
        log.debugf("Stargazer cache refreshed with %d entries", stargazers.size());
    }
}
