package com.mouse.tracker.enums;

public enum LoadState {
    LOADING,
    DOM_READY,
    COMPLETE
}
