package com.mouse.tracker.enums;

/**
 * Lifecycle of one sandbox opened for a schedule firing.
 */
public enum WorkerStatus {
    LOADING,
    INJECTING,
    READY,
    TRACKING,
    COMPLETED,
    ERROR,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == TIMED_OUT;
    }
}
