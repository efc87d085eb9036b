package com.modulestack.resolver.spi;

import java.util.Optional;

/**
 * Process-wide key/value settings read by the build backend.
 */
public interface SettingsStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);

    /**
     * Set {@code key} until the returned handle is closed, then restore the previous
     * value, or remove the key if it had none.
     */
    default ScopedOverride override(String key, String value) {
        Optional<String> previous = get(key);
        set(key, value);
        return ScopedOverride.of(() -> {
            if (previous.isPresent()) {
                set(key, previous.get());
            } else {
                remove(key);
            }
        });
    }
}
