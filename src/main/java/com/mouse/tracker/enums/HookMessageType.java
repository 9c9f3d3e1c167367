package com.mouse.tracker.enums;

public enum HookMessageType {
    READY,
    HEARTBEAT,
    REQUEST,
    RESPONSE,
    ERROR
}
