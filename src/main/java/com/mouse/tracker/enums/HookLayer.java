package com.mouse.tracker.enums;

/**
 * Where an exchange was observed: the browser network stack or the patched page APIs.
 */
public enum HookLayer {
    NETWORK,
    PAGE
}
