package com.my.seatbot.domain.port.out;

import java.util.List;

/**
 * Whole-document persistence for one registry. {@link #saveAll} replaces everything previously stored.
 */
public interface RecordStore<T> {

    List<T> load();

    void saveAll(List<T> records);
}
