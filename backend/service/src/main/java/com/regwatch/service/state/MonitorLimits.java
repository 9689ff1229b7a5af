package com.regwatch.service.state;

public record MonitorLimits(int logCapacity, int sweepCapacity, int changeCapacity) {
    public static final int DEFAULT_LOG_CAPACITY = 100;
    public static final int DEFAULT_SWEEP_CAPACITY = 50;
    public static final int DEFAULT_CHANGE_CAPACITY = 500;

    public MonitorLimits {
        if (logCapacity < 1 || sweepCapacity < 1 || changeCapacity < 1) {
            throw new IllegalArgumentException("Ring capacities must be positive");
        }
    }

    public static MonitorLimits defaults() {
        return new MonitorLimits(DEFAULT_LOG_CAPACITY, DEFAULT_SWEEP_CAPACITY, DEFAULT_CHANGE_CAPACITY);
    }
}
