package com.regwatch.service.runtime;

import com.regwatch.collectors.api.FetchException;
import com.regwatch.collectors.api.Fingerprinter;
import com.regwatch.collectors.detect.ChangeDetector;
import com.regwatch.collectors.detect.Outcome;
import com.regwatch.core.bus.EventBus;
import com.regwatch.core.events.ChangeDetected;
import com.regwatch.core.events.NotificationFailed;
import com.regwatch.core.events.SourceCheckFailed;
import com.regwatch.core.events.SourceChecked;
import com.regwatch.core.events.SweepCompleted;
import com.regwatch.core.events.SweepSkipped;
import com.regwatch.core.events.SweepStarted;
import com.regwatch.core.model.Change;
import com.regwatch.core.model.Source;
import com.regwatch.core.model.SourceRegistry;
import com.regwatch.core.model.SweepRecord;
import com.regwatch.service.notify.Notifier;
import com.regwatch.service.state.MonitorState;
import com.regwatch.service.store.HistoryStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives sweeps over the source registry.
 *
 * <p>At most one sweep runs at a time: the timer and on-demand requests share one
 * single-flight guard and a request that finds a sweep in flight is answered
 * immediately, never queued. Inside a sweep sources are checked one after another
 * with a fixed pause between fetches, and a failing source is recorded and skipped.
 */
public class SweepScheduler {
    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_MANUAL = "manual";

    private static final Logger LOGGER = Logger.getLogger(SweepScheduler.class.getName());

    private final SourceRegistry registry;
    private final Fingerprinter fingerprinter;
    private final ChangeDetector detector;
    private final MonitorState state;
    private final Notifier notifier;
    private final HistoryStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final Pacer pacer;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicBoolean started = new AtomicBoolean();
    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(daemonThreads("regwatch-timer"));
    private final ExecutorService sweepExecutor =
            Executors.newSingleThreadExecutor(daemonThreads("regwatch-sweep"));

    public SweepScheduler(
            SourceRegistry registry,
            Fingerprinter fingerprinter,
            ChangeDetector detector,
            MonitorState state,
            Notifier notifier,
            HistoryStore store,
            EventBus eventBus,
            Clock clock,
            SchedulerSettings settings,
            Pacer pacer
    ) {
        this.registry = registry;
        this.fingerprinter = fingerprinter;
        this.detector = detector;
        this.state = state;
        this.notifier = notifier;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
        this.settings = settings;
        this.pacer = pacer;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        state.scheduleNextSweep(clock.instant().plus(settings.initialDelay()));
        timerExecutor.scheduleAtFixedRate(
                () -> trigger(TRIGGER_SCHEDULED),
                settings.initialDelay().toMillis(),
                settings.interval().toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    /**
     * Starts a sweep in the background unless one is already in flight.
     */
    public CheckRequest requestCheck() {
        return trigger(TRIGGER_MANUAL);
    }

    /**
     * Runs a sweep on the calling thread under the same single-flight guard.
     *
     * @return the report, or empty when another sweep holds the guard or the scheduler is stopping
     */
    public Optional<SweepReport> runOnce(String trigger) {
        if (!accepting.get() || !running.compareAndSet(false, true)) {
            return Optional.empty();
        }
        try {
            return Optional.of(executeSweep(trigger));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops taking sweeps, gives an in-flight sweep the grace period to reach the next
     * source boundary, then flushes the state.
     */
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        timerExecutor.shutdownNow();
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                sweepExecutor.shutdownNow();
                sweepExecutor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        store.saveCurrent(state::snapshot);
    }

    private CheckRequest trigger(String trigger) {
        if (!accepting.get()) {
            return CheckRequest.SHUTTING_DOWN;
        }
        if (!running.compareAndSet(false, true)) {
            eventBus.publish(new SweepSkipped(clock.instant(), trigger, "a check is already running"));
            return CheckRequest.ALREADY_RUNNING;
        }
        try {
            sweepExecutor.execute(() -> {
                try {
                    executeSweep(trigger);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.SEVERE, "Sweep aborted unexpectedly", e);
                } finally {
                    running.set(false);
                }
            });
            return CheckRequest.ACCEPTED;
        } catch (RejectedExecutionException e) {
            running.set(false);
            return CheckRequest.SHUTTING_DOWN;
        }
    }

    private SweepReport executeSweep(String trigger) {
        Instant startedAt = clock.instant();
        List<Source> sources = registry.sources();
        eventBus.publish(new SweepStarted(startedAt, trigger, sources.size()));

        List<Change> changes = new ArrayList<>();
        int checked = 0;
        int failed = 0;
        boolean interrupted = false;
        for (int i = 0; i < sources.size(); i++) {
            if (!accepting.get() || Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            SourceResult result = checkSource(sources.get(i), changes);
            if (result == SourceResult.INTERRUPTED) {
                interrupted = true;
                break;
            }
            checked++;
            if (result == SourceResult.FAILED) {
                failed++;
            }
            if (i < sources.size() - 1) {
                try {
                    pacer.pause(settings.spacing());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    break;
                }
            }
        }

        Instant finishedAt = clock.instant();
        long durationMillis = Duration.between(startedAt, finishedAt).toMillis();
        SweepRecord record = new SweepRecord(startedAt, checked, changes.size(), failed, durationMillis);
        state.completeSweep(record, finishedAt.plus(settings.interval()));
        eventBus.publish(new SweepCompleted(finishedAt, checked, changes.size(), failed, durationMillis, interrupted));

        List<Change> batch = List.copyOf(changes);
        if (!batch.isEmpty()) {
            try {
                notifier.notifyChanges(batch);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Notifier failed for " + batch.size() + " change(s)", e);
                String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                eventBus.publish(new NotificationFailed(clock.instant(), batch.size(), reason));
            }
        }
        store.saveCurrent(state::snapshot);
        return new SweepReport(record, batch, interrupted);
    }

    private SourceResult checkSource(Source source, List<Change> changes) {
        Instant fetchStartedAt = clock.instant();
        try {
            String digest = fingerprinter.fingerprint(source);
            Instant now = clock.instant();
            Outcome outcome = detector.evaluate(source, digest, now);
            if (outcome instanceof Outcome.Changed changed) {
                Change change = changed.change();
                state.recordChange(change);
                changes.add(change);
                eventBus.publish(new ChangeDetected(
                        now,
                        source.id(),
                        source.displayName(),
                        source.category(),
                        source.priority(),
                        change.previousDigest(),
                        change.newDigest()
                ));
            }
            eventBus.publish(new SourceChecked(
                    now,
                    source.id(),
                    source.displayName(),
                    outcome.label(),
                    Duration.between(fetchStartedAt, now).toMillis()
            ));
            return SourceResult.OK;
        } catch (FetchException e) {
            Instant now = clock.instant();
            detector.recordFailure(source, e, now);
            publishFailure(source, e.kind().name(), e.getMessage(), now);
            return SourceResult.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SourceResult.INTERRUPTED;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unexpected failure checking " + source.url(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            Instant now = clock.instant();
            detector.recordFailure(source, message, now);
            publishFailure(source, "UNEXPECTED", message, now);
            return SourceResult.FAILED;
        }
    }

    private void publishFailure(Source source, String kind, String message, Instant now) {
        eventBus.publish(new SourceCheckFailed(now, source.id(), source.displayName(), kind, message));
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private enum SourceResult {
        OK,
        FAILED,
        INTERRUPTED
    }
}
