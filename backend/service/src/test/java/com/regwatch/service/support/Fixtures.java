package com.regwatch.service.support;

import com.regwatch.core.model.Change;
import com.regwatch.core.model.HistoryEntry;
import com.regwatch.core.model.Priority;
import com.regwatch.core.model.Source;
import com.regwatch.core.model.SourceCategory;

import java.time.Instant;

public final class Fixtures {
    public static final Source EUDR_PAGE = new Source(
            "https://environment.ec.europa.eu/topics/forests/deforestation_en",
            "EUDR Guidance Documents",
            SourceCategory.EUDR,
            Priority.MEDIUM
    );
    public static final Source FSC_PAGE = new Source(
            "https://fsc.org/en/newscentre",
            "FSC International - News Centre",
            SourceCategory.FSC,
            Priority.HIGH
    );
    public static final Source CRITICAL_PAGE = new Source(
            "https://trade.ec.europa.eu/eudr-delay",
            "EUDR 2026 Delay & Amendments",
            SourceCategory.EUDR,
            Priority.CRITICAL
    );

    private Fixtures() {
    }

    public static Change change(Source source, Instant detectedAt) {
        HistoryEntry previous = HistoryEntry.checked(source, "old", detectedAt.minusSeconds(3600));
        return Change.detected(source, previous, "new", detectedAt);
    }
}
