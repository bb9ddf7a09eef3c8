package com.mailmind.store;

import java.util.Optional;

/**
 * Durable key/value preferences.
 */
public interface PreferenceStore {

    Optional<String> get(String key);

    /**
     * Insert or replace the value stored under {@code key}.
     */
    void set(String key, String value);
}
