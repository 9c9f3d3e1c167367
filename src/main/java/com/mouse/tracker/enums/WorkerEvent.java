package com.mouse.tracker.enums;

public enum WorkerEvent {
    LOAD_STARTED,
    HOOKS_READY,
    EXCHANGE_CAPTURED,
    CAPTURE_WINDOW_ELAPSED,
    TIMEOUT,
    SANDBOX_REMOVED,
    FAILURE
}
