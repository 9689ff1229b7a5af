package com.regwatch.collectors.detect;

import com.regwatch.collectors.api.FetchException;
import com.regwatch.collectors.api.HistoryLedger;
import com.regwatch.core.model.Change;
import com.regwatch.core.model.HistoryEntry;
import com.regwatch.core.model.Source;

import java.time.Instant;
import java.util.Optional;

/**
 * Compares fresh digests against the stored baseline.
 *
 * <p>A source without a baseline digest is recorded silently as {@link Outcome.FirstSeen};
 * only a mismatch against an existing baseline produces a {@link Change}. Fetch
 * failures never touch the baseline.
 */
public class ChangeDetector {
    private final HistoryLedger ledger;

    public ChangeDetector(HistoryLedger ledger) {
        this.ledger = ledger;
    }

    public Outcome evaluate(Source source, String digest, Instant now) {
        Optional<HistoryEntry> previous = ledger.findHistory(source.id());
        ledger.putHistory(HistoryEntry.checked(source, digest, now));

        if (previous.isEmpty() || !previous.get().hasBaseline()) {
            return new Outcome.FirstSeen();
        }
        if (previous.get().lastDigest().equals(digest)) {
            return new Outcome.Unchanged();
        }
        return new Outcome.Changed(Change.detected(source, previous.get(), digest, now));
    }

    public HistoryEntry recordFailure(Source source, FetchException failure, Instant now) {
        return recordFailure(source, failure.getMessage(), now);
    }

    public HistoryEntry recordFailure(Source source, String message, Instant now) {
        HistoryEntry base = ledger.findHistory(source.id())
                .orElseGet(() -> new HistoryEntry(
                        source.id(),
                        source.displayName(),
                        source.category(),
                        null,
                        null,
                        null,
                        null,
                        null
                ));
        HistoryEntry failed = base.withError(message, now);
        ledger.putHistory(failed);
        return failed;
    }
}
