package com.mouse.tracker.interfaces;

import com.mouse.tracker.model.NetworkEvent;
import com.mouse.tracker.model.SandboxHandle;

@FunctionalInterface
public interface NetworkListener {
    void onNetworkEvent(SandboxHandle handle, NetworkEvent event);
}
