package com.mouse.tracker.enums;

public enum FiringPhase {
    IDLE,
    CLAIMED,
    FIRING
}
