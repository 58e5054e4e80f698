package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.DonationClaim;
import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.RecordStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Donation claims keyed by chat id, one per recipient. Same locking and rewrite model as
 * {@link SubscriberRegistry}.
 */
public class DonationRegistry {

    private final RecordStore<DonationClaim> store;
    private final ClockPort clockPort;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DonationClaim> claims = new LinkedHashMap<>();

    public DonationRegistry(RecordStore<DonationClaim> store, ClockPort clockPort) {
        this.store = store;
        this.clockPort = clockPort;
        for (DonationClaim claim : store.load()) {
            claims.put(claim.chatId(), claim);
        }
    }

    /**
     * Records a claim, replacing whatever the recipient submitted before.
     */
    public DonationClaim addClaim(String chatId, ChatUser profile, String reference) {
        lock.lock();
        try {
            DonationClaim claim = DonationClaim.submitted(chatId, profile, reference, clockPort.now());
            claims.put(chatId, claim);
            persist();
            return claim;
        } finally {
            lock.unlock();
        }
    }

    public boolean setVerified(String chatId, boolean verified) {
        lock.lock();
        try {
            DonationClaim existing = claims.get(chatId);
            if (existing == null) {
                return false;
            }
            claims.put(chatId, existing.withVerified(verified));
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String chatId) {
        lock.lock();
        try {
            if (claims.remove(chatId) == null) {
                return false;
            }
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<DonationClaim> get(String chatId) {
        lock.lock();
        try {
            return Optional.ofNullable(claims.get(chatId));
        } finally {
            lock.unlock();
        }
    }

    public boolean isVerified(String chatId) {
        return get(chatId).map(DonationClaim::verified).orElse(false);
    }

    public List<DonationClaim> listUnverified() {
        lock.lock();
        try {
            return claims.values().stream().filter(claim -> !claim.verified()).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<DonationClaim> listVerified() {
        lock.lock();
        try {
            return claims.values().stream().filter(DonationClaim::verified).toList();
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        store.saveAll(new ArrayList<>(claims.values()));
    }
}
