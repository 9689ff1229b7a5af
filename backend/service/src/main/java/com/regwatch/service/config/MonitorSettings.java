package com.regwatch.service.config;

import com.regwatch.collectors.fetch.FetchSettings;
import com.regwatch.service.notify.AlertMessageFormatter;
import com.regwatch.service.runtime.SchedulerSettings;

import java.net.URI;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Process settings read from environment variables. Unset variables fall back to
 * defaults; malformed values fail startup.
 */
public record MonitorSettings(
        int port,
        Duration checkInterval,
        Optional<URI> webhookUrl,
        Path stateFile,
        Path configDir,
        Duration fetchTimeout,
        Duration requestSpacing,
        Duration initialDelay,
        String userAgent,
        String dashboardUrl,
        ZoneId alertZone
) {
    public static final int DEFAULT_PORT = 3000;

    public static MonitorSettings fromEnvironment(Map<String, String> env) {
        return new MonitorSettings(
                parsePort(env.get("PORT")),
                durationOrDefault(env, "CHECK_INTERVAL", SchedulerSettings.DEFAULT_INTERVAL),
                webhook(env.get("WEBHOOK_URL")),
                Path.of(valueOrDefault(env, "STATE_FILE", "state/state.json")),
                Path.of(valueOrDefault(env, "CONFIG_DIR", "config")),
                durationOrDefault(env, "FETCH_TIMEOUT", FetchSettings.DEFAULT_TIMEOUT),
                durationOrDefault(env, "REQUEST_SPACING", SchedulerSettings.DEFAULT_SPACING),
                durationOrDefault(env, "INITIAL_DELAY", SchedulerSettings.DEFAULT_INITIAL_DELAY),
                valueOrDefault(env, "USER_AGENT", FetchSettings.DEFAULT_USER_AGENT),
                blankToNull(env.get("DASHBOARD_URL")),
                zone(env.get("ALERT_TIME_ZONE"))
        );
    }

    public SchedulerSettings schedulerSettings() {
        return new SchedulerSettings(checkInterval, requestSpacing, initialDelay, SchedulerSettings.DEFAULT_SHUTDOWN_GRACE);
    }

    public FetchSettings fetchSettings() {
        return new FetchSettings(fetchTimeout, userAgent);
    }

    /**
     * Accepts ISO-8601 durations ({@code PT1H}), a bare number of seconds, or a number
     * with an {@code ms}, {@code s}, {@code m} or {@code h} suffix.
     */
    static Duration parseDuration(String name, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        try {
            if (value.startsWith("p") || value.startsWith("-p")) {
                return requireNonNegative(name, Duration.parse(value.toUpperCase(Locale.ROOT)));
            }
            if (value.endsWith("ms")) {
                return requireNonNegative(name, Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2))));
            }
            char unit = value.charAt(value.length() - 1);
            if (Character.isDigit(unit)) {
                return requireNonNegative(name, Duration.ofSeconds(Long.parseLong(value)));
            }
            long amount = Long.parseLong(value.substring(0, value.length() - 1));
            switch (unit) {
                case 's':
                    return requireNonNegative(name, Duration.ofSeconds(amount));
                case 'm':
                    return requireNonNegative(name, Duration.ofMinutes(amount));
                case 'h':
                    return requireNonNegative(name, Duration.ofHours(amount));
                default:
                    throw new IllegalArgumentException(name + " has an unknown unit: " + raw);
            }
        } catch (NumberFormatException | DateTimeParseException | StringIndexOutOfBoundsException e) {
            throw new IllegalArgumentException(name + " is not a valid duration: " + raw, e);
        }
    }

    private static Duration requireNonNegative(String name, Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return duration;
    }

    private static Duration durationOrDefault(Map<String, String> env, String name, Duration fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return parseDuration(name, raw);
    }

    private static int parsePort(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("PORT out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("PORT is not a number: " + raw, e);
        }
    }

    private static Optional<URI> webhook(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("WEBHOOK_URL is not a valid URI", e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("WEBHOOK_URL must use http or https");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("WEBHOOK_URL has no host");
        }
        return Optional.of(uri);
    }

    private static ZoneId zone(String raw) {
        if (raw == null || raw.isBlank()) {
            return AlertMessageFormatter.DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("ALERT_TIME_ZONE is not a valid zone: " + raw, e);
        }
    }

    private static String valueOrDefault(Map<String, String> env, String name, String fallback) {
        String raw = env.get(name);
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
