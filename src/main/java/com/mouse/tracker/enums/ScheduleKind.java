package com.mouse.tracker.enums;

public enum ScheduleKind {
    CRON,
    INTERVAL,
    ONCE
}
