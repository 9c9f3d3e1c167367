package com.mouse.tracker.enums;

/**
 * ISOLATED code runs once in the current document only.
 * PAGE code is also registered to run before page scripts on every later navigation.
 */
public enum VisibilityLevel {
    ISOLATED,
    PAGE
}
