package com.mouse.tracker.interfaces;

import com.mouse.tracker.model.SandboxHandle;

@FunctionalInterface
public interface MessageListener {
    void onMessage(SandboxHandle handle, String payload);
}
