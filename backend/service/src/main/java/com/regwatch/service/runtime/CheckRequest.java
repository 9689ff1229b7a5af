package com.regwatch.service.runtime;

import java.util.Locale;

public enum CheckRequest {
    ACCEPTED,
    ALREADY_RUNNING,
    /** The scheduler is stopping and takes no new sweeps. */
    SHUTTING_DOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
