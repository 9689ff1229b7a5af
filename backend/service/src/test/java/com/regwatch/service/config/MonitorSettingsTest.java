package com.regwatch.service.config;

import com.regwatch.service.notify.AlertMessageFormatter;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorSettingsTest {
    @Test
    void defaultsApplyWhenEnvironmentIsEmpty() {
        MonitorSettings settings = MonitorSettings.fromEnvironment(Map.of());

        assertEquals(3000, settings.port());
        assertEquals(Duration.ofHours(1), settings.checkInterval());
        assertEquals(Optional.empty(), settings.webhookUrl());
        assertEquals(Path.of("state/state.json"), settings.stateFile());
        assertEquals(Path.of("config"), settings.configDir());
        assertEquals(Duration.ofSeconds(30), settings.fetchTimeout());
        assertEquals(Duration.ofSeconds(2), settings.requestSpacing());
        assertEquals(Duration.ofSeconds(10), settings.initialDelay());
        assertNull(settings.dashboardUrl());
        assertEquals(AlertMessageFormatter.DEFAULT_ZONE, settings.alertZone());
    }

    @Test
    void readsOverrides() {
        MonitorSettings settings = MonitorSettings.fromEnvironment(Map.of(
                "PORT", "8080",
                "CHECK_INTERVAL", "PT30M",
                "WEBHOOK_URL", "https://chat.example.org/hook",
                "REQUEST_SPACING", "500ms",
                "FETCH_TIMEOUT", "15",
                "ALERT_TIME_ZONE", "Europe/Brussels",
                "DASHBOARD_URL", "https://monitor.example.org"
        ));

        assertEquals(8080, settings.port());
        assertEquals(Duration.ofMinutes(30), settings.schedulerSettings().interval());
        assertEquals(Duration.ofMillis(500), settings.schedulerSettings().spacing());
        assertEquals(Duration.ofSeconds(15), settings.fetchSettings().requestTimeout());
        assertEquals(Optional.of(URI.create("https://chat.example.org/hook")), settings.webhookUrl());
        assertEquals(ZoneId.of("Europe/Brussels"), settings.alertZone());
        assertEquals("https://monitor.example.org", settings.dashboardUrl());
    }

    @Test
    void parsesDurationForms() {
        assertEquals(Duration.ofHours(2), MonitorSettings.parseDuration("X", "PT2H"));
        assertEquals(Duration.ofSeconds(90), MonitorSettings.parseDuration("X", "90"));
        assertEquals(Duration.ofSeconds(45), MonitorSettings.parseDuration("X", "45s"));
        assertEquals(Duration.ofMinutes(5), MonitorSettings.parseDuration("X", "5m"));
        assertEquals(Duration.ofHours(1), MonitorSettings.parseDuration("X", "1h"));
        assertEquals(Duration.ofMillis(250), MonitorSettings.parseDuration("X", "250ms"));
    }

    @Test
    void rejectsInvalidValues() {
        IllegalArgumentException badDuration = assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.fromEnvironment(Map.of("CHECK_INTERVAL", "soon")));
        assertTrue(badDuration.getMessage().contains("CHECK_INTERVAL"));

        assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.fromEnvironment(Map.of("CHECK_INTERVAL", "0")).schedulerSettings());
        assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.parseDuration("REQUEST_SPACING", "-PT1S"));

        IllegalArgumentException badPort = assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.fromEnvironment(Map.of("PORT", "http")));
        assertTrue(badPort.getMessage().startsWith("PORT is not a number"));
        assertThrows(IllegalArgumentException.class, () -> MonitorSettings.fromEnvironment(Map.of("PORT", "70000")));

        assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.fromEnvironment(Map.of("WEBHOOK_URL", "ftp://chat.example.org")));
        IllegalArgumentException noHost = assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.fromEnvironment(Map.of("WEBHOOK_URL", "https:///hooks/abc")));
        assertTrue(noHost.getMessage().contains("no host"));
        assertThrows(IllegalArgumentException.class,
                () -> MonitorSettings.fromEnvironment(Map.of("ALERT_TIME_ZONE", "Mars/Olympus")));
    }
}
