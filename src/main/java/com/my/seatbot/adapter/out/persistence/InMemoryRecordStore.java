package com.my.seatbot.adapter.out.persistence;

import com.my.seatbot.domain.port.out.RecordStore;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-durable store for local runs and tests, selected with {@code app.storage.backend=memory}.
 */
public class InMemoryRecordStore<T> implements RecordStore<T> {

    private final AtomicReference<List<T>> records = new AtomicReference<>(List.of());

    @Override
    public List<T> load() {
        return records.get();
    }

    @Override
    public void saveAll(List<T> values) {
        records.set(List.copyOf(values));
    }
}
