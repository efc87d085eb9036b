package com.modulestack.resolver.backend;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.spi.SettingsStore;

import lombok.experimental.UtilityClass;

/**
 * Applies a batch of settings, logging every change.
 */
@UtilityClass
public class SettingsUpdater {
    private static final Logger log = LoggerFactory.getLogger(SettingsUpdater.class);

    /**
     * @param overwrite replace values that are already set; unset keys are always written
     * @return number of keys written
     */
    public int update(SettingsStore store, Map<String, String> settings, boolean overwrite) {
        int written = 0;
        for (Map.Entry<String, String> entry : settings.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            Optional<String> old = store.get(key);
            if (old.isPresent() && old.get().equals(value)) {
                continue;
            }
            if (old.isPresent()) {
                if (overwrite) {
                    log.debug("Settings overwriting {}: old={} new={}", key, old.get(), value);
                    store.set(key, value);
                    written++;
                } else {
                    log.debug("Settings not overwriting: {}={}", key, old.get());
                }
            } else {
                log.debug("Settings {}={}", key, value);
                store.set(key, value);
                written++;
            }
        }
        return written;
    }
}
