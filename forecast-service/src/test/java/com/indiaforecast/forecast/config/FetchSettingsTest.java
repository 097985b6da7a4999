package com.indiaforecast.forecast.config;

import com.indiaforecast.common.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FetchSettingsTest {

    private static final Duration ONE_SECOND = Duration.ofSeconds(1);

    @Test
    void defaultsAreValid() {
        FetchSettings settings = FetchSettings.defaults();
        assertEquals(Duration.ofSeconds(30), settings.requestTimeout());
        assertEquals(3, settings.maxRetries());
        assertEquals(4, settings.maxConcurrentRequests());
        assertEquals(Duration.ofHours(1), settings.liveTtl());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> new FetchSettings(Duration.ZERO, 3, ONE_SECOND, ONE_SECOND, 4, ONE_SECOND, ONE_SECOND));
        assertEquals("forecast.fetch.request-timeout", e.getProperty());
    }

    @Test
    void negativeRetriesAreRejected() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> new FetchSettings(ONE_SECOND, -1, ONE_SECOND, ONE_SECOND, 4, ONE_SECOND, ONE_SECOND));
        assertEquals("forecast.fetch.max-retries", e.getProperty());
    }

    @Test
    void concurrencyBelowOneIsRejected() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> new FetchSettings(ONE_SECOND, 3, ONE_SECOND, ONE_SECOND, 0, ONE_SECOND, ONE_SECOND));
        assertEquals("forecast.fetch.max-concurrent-requests", e.getProperty());
    }

    @Test
    void zeroInterRequestDelayIsAllowed() {
        assertDoesNotThrow(() -> new FetchSettings(ONE_SECOND, 0, ONE_SECOND, Duration.ZERO, 1, ONE_SECOND, ONE_SECOND));
    }

    @Test
    void calibrationWindowsParse() {
        assertEquals(List.of(new CalibrationWindow(1975, 2000), new CalibrationWindow(1997, 2002)),
            CalibrationWindow.parseList(" 1975:2000 , 1997:2002"));
        assertTrue(CalibrationWindow.parseList("").isEmpty());
    }

    @Test
    void malformedCalibrationWindowsAreRejected() {
        assertThrows(InvalidConfigurationException.class, () -> CalibrationWindow.parseList("1975-2000"));
        assertThrows(InvalidConfigurationException.class, () -> CalibrationWindow.parseList("abc:2000"));
        assertThrows(InvalidConfigurationException.class, () -> CalibrationWindow.parseList("2000:1975"));
    }
}
