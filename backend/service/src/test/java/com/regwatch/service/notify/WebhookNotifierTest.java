package com.regwatch.service.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.regwatch.core.bus.EventBus;
import com.regwatch.core.events.NotificationDelivered;
import com.regwatch.core.events.NotificationFailed;
import com.regwatch.core.util.JsonUtils;
import com.regwatch.service.support.EventCapture;
import com.regwatch.service.support.Fixtures;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookNotifierTest {
    private static final Instant T0 = Instant.parse("2026-02-12T20:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();
    private final AtomicInteger responseStatus = new AtomicInteger(204);
    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postsFormattedTextAsJson() throws Exception {
        WebhookNotifier notifier = notifier(startServer());

        notifier.notifyChanges(List.of(Fixtures.change(Fixtures.CRITICAL_PAGE, T0)));

        assertEquals(1, bodies.size());
        assertEquals("application/json", contentTypes.get(0));
        JsonNode payload = JsonUtils.objectMapper().readTree(bodies.get(0));
        assertTrue(payload.get("text").asText().startsWith("🚨🚨 **CRITICAL EUDR/FSC UPDATE**"));
        assertTrue(payload.get("text").asText().contains(Fixtures.CRITICAL_PAGE.url()));

        List<NotificationDelivered> delivered = capture.byType(NotificationDelivered.class);
        assertEquals(1, delivered.size());
        assertEquals(1, delivered.get(0).changeCount());
        assertEquals(204, delivered.get(0).statusCode());
    }

    @Test
    void emptyBatchSendsNothing() throws Exception {
        WebhookNotifier notifier = notifier(startServer());

        notifier.notifyChanges(List.of());

        assertTrue(bodies.isEmpty());
        assertTrue(capture.all().isEmpty());
    }

    @Test
    void non2xxIsReportedOnceWithoutRetry() throws Exception {
        responseStatus.set(500);
        WebhookNotifier notifier = notifier(startServer());

        notifier.notifyChanges(List.of(Fixtures.change(Fixtures.FSC_PAGE, T0), Fixtures.change(Fixtures.EUDR_PAGE, T0)));

        assertEquals(1, bodies.size());
        List<NotificationFailed> failed = capture.byType(NotificationFailed.class);
        assertEquals(1, failed.size());
        assertEquals(2, failed.get(0).changeCount());
        assertEquals("HTTP 500", failed.get(0).reason());
    }

    @Test
    void unreachableWebhookIsReportedNotThrown() throws Exception {
        URI target = startServer();
        server.stop(0);
        server = null;
        WebhookNotifier notifier = notifier(target);

        notifier.notifyChanges(List.of(Fixtures.change(Fixtures.FSC_PAGE, T0)));

        assertEquals(1, capture.byType(NotificationFailed.class).size());
    }

    @Test
    void webhookWithoutHostIsReportedNotThrown() {
        WebhookNotifier notifier = notifier(URI.create("https:///hooks/abc"));

        assertDoesNotThrow(() -> notifier.notifyChanges(List.of(Fixtures.change(Fixtures.FSC_PAGE, T0))));

        List<NotificationFailed> failed = capture.byType(NotificationFailed.class);
        assertEquals(1, failed.size());
        assertEquals(1, failed.get(0).changeCount());
    }

    private WebhookNotifier notifier(URI target) {
        return new WebhookNotifier(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
                target,
                Duration.ofSeconds(5),
                new AlertMessageFormatter("EUDR/FSC", AlertMessageFormatter.DEFAULT_ZONE, null, CLOCK),
                bus,
                CLOCK
        );
    }

    private URI startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            exchange.sendResponseHeaders(responseStatus.get(), -1);
            exchange.close();
        });
        server.start();
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/hook");
    }
}
