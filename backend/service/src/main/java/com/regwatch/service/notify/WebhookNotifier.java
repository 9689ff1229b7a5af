package com.regwatch.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.regwatch.core.bus.EventBus;
import com.regwatch.core.events.NotificationDelivered;
import com.regwatch.core.events.NotificationFailed;
import com.regwatch.core.model.Change;
import com.regwatch.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts {@code {"text": "..."}} to a chat webhook. A failed delivery is reported
 * and dropped; the next sweep only reports its own changes.
 */
public class WebhookNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(WebhookNotifier.class.getName());

    private final HttpClient httpClient;
    private final URI webhook;
    private final Duration timeout;
    private final AlertMessageFormatter formatter;
    private final EventBus eventBus;
    private final Clock clock;

    public WebhookNotifier(
            HttpClient httpClient,
            URI webhook,
            Duration timeout,
            AlertMessageFormatter formatter,
            EventBus eventBus,
            Clock clock
    ) {
        this.httpClient = httpClient;
        this.webhook = webhook;
        this.timeout = timeout;
        this.formatter = formatter;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void notifyChanges(List<Change> changes) {
        if (changes == null || changes.isEmpty()) {
            return;
        }
        byte[] payload;
        try {
            payload = JsonUtils.objectMapper().writeValueAsBytes(Map.of("text", formatter.format(changes)));
        } catch (JsonProcessingException e) {
            fail(changes.size(), "could not encode payload: " + e.getOriginalMessage(), e);
            return;
        }

        try {
            HttpRequest request = HttpRequest.newBuilder(webhook)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                eventBus.publish(new NotificationDelivered(clock.instant(), changes.size(), response.statusCode()));
            } else {
                fail(changes.size(), "HTTP " + response.statusCode(), null);
            }
        } catch (IOException | RuntimeException e) {
            fail(changes.size(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(changes.size(), "interrupted", e);
        }
    }

    private void fail(int changeCount, String reason, Exception cause) {
        LOGGER.log(Level.WARNING, "Webhook delivery to " + webhook.getHost() + " failed: " + reason, cause);
        eventBus.publish(new NotificationFailed(clock.instant(), changeCount, reason));
    }
}
