package com.flinkcursor.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PollingConfig Tests")
class PollingConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(PollingConfig.PROP_FETCH_INTERVAL_MS);
    }

    @Test
    @DisplayName("Default interval is 100ms")
    void defaultInterval() {
        assertEquals(100, PollingConfig.DEFAULT_FETCH_INTERVAL_MS);
        assertEquals(100, PollingConfig.configuredFetchIntervalMs());
    }

    @ParameterizedTest
    @CsvSource({
        "0, 0",
        "1, 1",
        "250, 250",
        "-1, 100",
        "-500, 100"
    })
    @DisplayName("normalizeFetchInterval keeps non-negative values")
    void normalizeFetchInterval(long input, long expected) {
        assertEquals(expected, PollingConfig.normalizeFetchInterval(input));
    }

    @Test
    @DisplayName("System property overrides the interval")
    void systemPropertyOverride() {
        System.setProperty(PollingConfig.PROP_FETCH_INTERVAL_MS, "25");
        assertEquals(25, PollingConfig.configuredFetchIntervalMs());
    }

    @Test
    @DisplayName("Invalid system property falls back to the default")
    void invalidSystemProperty() {
        System.setProperty(PollingConfig.PROP_FETCH_INTERVAL_MS, "fast");
        assertEquals(PollingConfig.DEFAULT_FETCH_INTERVAL_MS, PollingConfig.configuredFetchIntervalMs());

        System.setProperty(PollingConfig.PROP_FETCH_INTERVAL_MS, "-10");
        assertEquals(PollingConfig.DEFAULT_FETCH_INTERVAL_MS, PollingConfig.configuredFetchIntervalMs());
    }
}
