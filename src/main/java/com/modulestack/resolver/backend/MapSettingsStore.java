package com.modulestack.resolver.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.modulestack.resolver.spi.SettingsStore;

/**
 * In-memory settings, iterated in insertion order.
 */
public class MapSettingsStore implements SettingsStore {

    private final Map<String, String> values = new LinkedHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
