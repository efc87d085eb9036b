package com.modulestack.resolver.backend;

import com.modulestack.resolver.spi.ScopedOverride;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SettingsUpdater and SettingsStore overrides.
 */
class SettingsUpdaterTest {

    private final MapSettingsStore store = new MapSettingsStore();

    @Test
    void testWritesUnsetKeys() {
        int written = SettingsUpdater.update(store, Map.of("ASYN", "R4.39"), false);

        assertThat(written).isEqualTo(1);
        assertThat(store.get("ASYN")).contains("R4.39");
    }

    @Test
    void testOverwriteControlsExistingValues() {
        store.set("ASYN", "R4.38");

        assertThat(SettingsUpdater.update(store, Map.of("ASYN", "R4.39"), false)).isZero();
        assertThat(store.get("ASYN")).contains("R4.38");

        assertThat(SettingsUpdater.update(store, Map.of("ASYN", "R4.39"), true)).isEqualTo(1);
        assertThat(store.get("ASYN")).contains("R4.39");
    }

    @Test
    void testUnchangedValuesAreSkipped() {
        store.set("ASYN", "R4.39");
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("ASYN", "R4.39");
        settings.put("ASYN_DEPTH", "-1");

        assertThat(SettingsUpdater.update(store, settings, true)).isEqualTo(1);
        assertThat(store.asMap()).containsExactly(entry("ASYN", "R4.39"), entry("ASYN_DEPTH", "-1"));
    }

    @Test
    void testOverrideRestoresPreviousValue() {
        store.set("REPOOWNER", "slac-epics");

        try (ScopedOverride ignored = store.override("REPOOWNER", "epics-modules")) {
            assertThat(store.get("REPOOWNER")).contains("epics-modules");
        }

        assertThat(store.get("REPOOWNER")).contains("slac-epics");
    }

    @Test
    void testOverrideOfUnsetKeyRemovesIt() {
        try (ScopedOverride ignored = store.override("REPOOWNER", "epics-modules")) {
            assertThat(store.get("REPOOWNER")).isPresent();
        }

        assertThat(store.get("REPOOWNER")).isEmpty();
    }
}
