package com.my.seatbot.domain.port.out;

import java.util.Map;

/**
 * Looks up user-facing text by key and fills {@code {name}} placeholders.
 * Returns the key itself when the template is missing or a placeholder has no value.
 */
public interface TranslationPort {

    String t(String key, Map<String, ?> params);

    default String t(String key) {
        return t(key, Map.of());
    }
}
