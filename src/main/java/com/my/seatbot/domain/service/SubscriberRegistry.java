package com.my.seatbot.domain.service;

import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.IdentityClaimResult;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.port.out.ClockPort;
import com.my.seatbot.domain.port.out.RecordStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Subscriber state keyed by chat id. Every operation runs under one lock and every mutation
 * rewrites the whole store.
 *
 * <p>Two registries over the same store do not coordinate; the last writer wins.
 */
public class SubscriberRegistry {

    private final RecordStore<Subscriber> store;
    private final ClockPort clockPort;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();

    public SubscriberRegistry(RecordStore<Subscriber> store, ClockPort clockPort) {
        this.store = store;
        this.clockPort = clockPort;
        for (Subscriber subscriber : store.load()) {
            subscribers.put(subscriber.chatId(), subscriber);
        }
    }

    /**
     * Creates the subscriber or reactivates an existing one, keeping preferences and verification.
     *
     * @return {@code true} if the recipient was unknown or inactive before this call
     */
    public boolean subscribe(String chatId, ChatUser profile) {
        lock.lock();
        try {
            Subscriber existing = subscribers.get(chatId);
            boolean isNew = existing == null || !existing.active();
            Subscriber updated = existing == null
                    ? Subscriber.newcomer(chatId, profile, clockPort.now())
                    : existing.reactivate(profile);
            subscribers.put(chatId, updated);
            persist();
            return isNew;
        } finally {
            lock.unlock();
        }
    }

    public void unsubscribe(String chatId) {
        lock.lock();
        try {
            Subscriber existing = subscribers.get(chatId);
            if (existing != null) {
                subscribers.put(chatId, existing.withActive(false));
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean setPreferences(String chatId, List<String> exams) {
        lock.lock();
        try {
            Subscriber existing = subscribers.get(chatId);
            if (existing == null) {
                return false;
            }
            subscribers.put(chatId, existing.withExams(exams));
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a verified identity unless another active subscriber already holds it.
     * The uniqueness check and the write happen under the same lock.
     */
    public IdentityClaimResult setVerifiedIdentity(String chatId, String identity) {
        lock.lock();
        try {
            Subscriber existing = subscribers.get(chatId);
            if (existing == null) {
                return IdentityClaimResult.NOT_SUBSCRIBED;
            }
            if (isClaimedElsewhere(chatId, identity)) {
                return IdentityClaimResult.ALREADY_CLAIMED;
            }
            subscribers.put(chatId, existing.withVerifiedIdentity(identity));
            persist();
            return IdentityClaimResult.VERIFIED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subscribes the sender if needed and stores the verified identity, all under one lock.
     * When another active subscriber holds the identity nothing is written, not even the
     * subscription of the sender.
     */
    public IdentityClaimResult claimIdentity(String chatId, ChatUser profile, String identity) {
        lock.lock();
        try {
            if (isClaimedElsewhere(chatId, identity)) {
                return IdentityClaimResult.ALREADY_CLAIMED;
            }
            Subscriber existing = subscribers.get(chatId);
            Subscriber subscribed;
            if (existing == null) {
                subscribed = Subscriber.newcomer(chatId, profile, clockPort.now());
            } else if (!existing.active()) {
                subscribed = existing.reactivate(profile);
            } else {
                subscribed = existing;
            }
            subscribers.put(chatId, subscribed.withVerifiedIdentity(identity));
            persist();
            return IdentityClaimResult.VERIFIED;
        } finally {
            lock.unlock();
        }
    }

    public boolean setIntervalMinutes(String chatId, int minutes) {
        lock.lock();
        try {
            Subscriber existing = subscribers.get(chatId);
            if (existing == null) {
                return false;
            }
            subscribers.put(chatId, existing.withIntervalMinutes(minutes));
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Subscriber> get(String chatId) {
        lock.lock();
        try {
            return Optional.ofNullable(subscribers.get(chatId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Subscriber> findByUserId(long userId) {
        lock.lock();
        try {
            return subscribers.values().stream()
                    .filter(subscriber -> subscriber.userId() != null && subscriber.userId() == userId)
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    public List<Subscriber> listActive() {
        lock.lock();
        try {
            return subscribers.values().stream().filter(Subscriber::active).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<Subscriber> listAll() {
        lock.lock();
        try {
            return List.copyOf(subscribers.values());
        } finally {
            lock.unlock();
        }
    }

    private boolean isClaimedElsewhere(String chatId, String identity) {
        return subscribers.values().stream()
                .filter(other -> !chatId.equals(other.chatId()))
                .anyMatch(other -> other.active() && other.holdsIdentity(identity));
    }

    private void persist() {
        store.saveAll(new ArrayList<>(subscribers.values()));
    }
}
