package com.regwatch.service.notify;

import com.regwatch.core.model.Change;
import com.regwatch.core.model.Priority;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Composes the single chat message sent for a batch of changes. Markdown-style
 * emphasis is used since the usual targets are chat webhooks.
 */
public class AlertMessageFormatter {
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Panama");

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("M/d/yyyy, h:mm:ss a", Locale.US);

    private final String label;
    private final ZoneId zone;
    private final String dashboardUrl;
    private final Clock clock;

    public AlertMessageFormatter(String label, ZoneId zone, String dashboardUrl, Clock clock) {
        this.label = label;
        this.zone = zone;
        this.dashboardUrl = dashboardUrl;
        this.clock = clock;
    }

    public String format(List<Change> changes) {
        boolean critical = changes.stream().anyMatch(change -> change.priority() == Priority.CRITICAL);
        StringBuilder message = new StringBuilder();
        if (critical) {
            message.append("🚨🚨 **CRITICAL ").append(label).append(" UPDATE** 🚨🚨\n\n");
        } else {
            message.append("🚨 **").append(label).append(" Change Alert**\n\n");
        }

        message.append(changes.size())
                .append(" change(s) detected at ")
                .append(TIME_FORMAT.format(clock.instant().atZone(zone)))
                .append("\n\n");

        for (Change change : changes) {
            message.append(marker(change.priority()))
                    .append(" **").append(change.category()).append("**: ")
                    .append(change.displayName()).append('\n')
                    .append("🔗 ").append(change.sourceId()).append("\n\n");
        }

        if (dashboardUrl != null && !dashboardUrl.isBlank()) {
            message.append("📊 View dashboard: ").append(dashboardUrl);
        }
        return message.toString().stripTrailing();
    }

    static String marker(Priority priority) {
        switch (priority) {
            case CRITICAL:
                return "🔴";
            case HIGH:
                return "🟠";
            default:
                return "🟡";
        }
    }
}
