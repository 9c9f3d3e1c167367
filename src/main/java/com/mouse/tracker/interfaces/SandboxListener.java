package com.mouse.tracker.interfaces;

import com.mouse.tracker.enums.LoadState;
import com.mouse.tracker.model.SandboxHandle;

public interface SandboxListener {

    void onLoadStateChanged(SandboxHandle handle, LoadState state);

    /** The sandbox went away without {@link SandboxPlatform#closeSandbox} (closed, crashed). */
    void onRemoved(SandboxHandle handle);
}
