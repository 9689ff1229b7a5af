package com.regwatch.service;

import com.regwatch.collectors.detect.ChangeDetector;
import com.regwatch.collectors.fetch.HttpFingerprinter;
import com.regwatch.core.bus.EventBus;
import com.regwatch.core.model.MonitorSnapshot;
import com.regwatch.core.model.SourceCategory;
import com.regwatch.core.model.SourceRegistry;
import com.regwatch.service.api.ApiServer;
import com.regwatch.service.api.MonitorService;
import com.regwatch.service.config.ConfigLoader;
import com.regwatch.service.config.MonitorSettings;
import com.regwatch.service.config.SourceCatalog;
import com.regwatch.service.http.HttpClientFactory;
import com.regwatch.service.log.EventLog;
import com.regwatch.service.log.EventLogRecorder;
import com.regwatch.service.notify.AlertMessageFormatter;
import com.regwatch.service.notify.Notifier;
import com.regwatch.service.notify.WebhookNotifier;
import com.regwatch.service.runtime.Pacer;
import com.regwatch.service.runtime.SweepScheduler;
import com.regwatch.service.state.MonitorLimits;
import com.regwatch.service.state.MonitorState;
import com.regwatch.service.store.JsonFileHistoryStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        MonitorSettings settings = MonitorSettings.fromEnvironment(System.getenv());
        Clock clock = Clock.systemUTC();

        SourceCatalog catalog = ConfigLoader.loadCatalog(settings.configDir());
        SourceRegistry registry = ConfigLoader.registry(catalog);

        EventBus eventBus = new EventBus();
        JsonFileHistoryStore store = new JsonFileHistoryStore(settings.stateFile(), eventBus, clock);
        MonitorSnapshot restored = store.load();
        MonitorState state = MonitorState.restore(restored, MonitorLimits.defaults());
        EventLog eventLog = new EventLog(state, clock);
        EventLogRecorder.attach(eventBus, eventLog);

        if (restored.totalSweeps() > 0) {
            eventLog.success("Restored monitoring data - " + restored.totalSweeps() + " checks performed");
        } else {
            eventLog.info("Starting fresh monitoring session");
        }
        Map<SourceCategory, Integer> perCategory = registry.countByCategory();
        perCategory.forEach((category, count) -> eventLog.info("Monitoring " + count + " " + category + " sources"));

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10));
        Notifier notifier = settings.webhookUrl()
                .<Notifier>map(url -> new WebhookNotifier(
                        httpClient,
                        url,
                        settings.fetchTimeout(),
                        new AlertMessageFormatter(labelOf(catalog), settings.alertZone(), settings.dashboardUrl(), clock),
                        eventBus,
                        clock
                ))
                .orElseGet(Notifier::disabled);

        SweepScheduler scheduler = new SweepScheduler(
                registry,
                new HttpFingerprinter(httpClient, settings.fetchSettings()),
                new ChangeDetector(state),
                state,
                notifier,
                store,
                eventBus,
                clock,
                settings.schedulerSettings(),
                Pacer.sleeping()
        );
        MonitorService monitorService = new MonitorService(registry, state, scheduler, store, eventLog);
        ApiServer apiServer = new ApiServer(settings.port(), monitorService);

        apiServer.start();
        eventLog.success("Server running on port " + apiServer.actualPort());
        if (notifier.enabled()) {
            eventLog.success("Webhook notifications configured");
        } else {
            eventLog.warning("Webhook not configured; changes will only show on the dashboard");
        }
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            eventLog.info("Shutting down...");
            apiServer.stop();
            scheduler.shutdown();
            shutdownLatch.countDown();
        }, "regwatch-shutdown"));

        shutdownLatch.await();
    }

    static String labelOf(SourceCatalog catalog) {
        if (catalog.label() != null && !catalog.label().isBlank()) {
            return catalog.label();
        }
        return "Regulatory";
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not apply bundled logging configuration", e);
        }
    }
}
