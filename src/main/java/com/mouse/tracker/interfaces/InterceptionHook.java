package com.mouse.tracker.interfaces;

import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.model.HookSettings;
import com.mouse.tracker.model.SandboxHandle;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * One way of observing the API traffic of a sandbox. Installing twice must not produce
 * duplicate messages.
 */
public interface InterceptionHook {

    HookLayer layer();

    CompletableFuture<Void> install(SandboxHandle handle, HookSettings settings, Consumer<HookMessage> sink);
}
