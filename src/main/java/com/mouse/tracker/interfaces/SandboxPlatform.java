package com.mouse.tracker.interfaces;

import com.mouse.tracker.enums.VisibilityLevel;
import com.mouse.tracker.model.SandboxHandle;

import java.util.concurrent.CompletableFuture;

/**
 * Isolated browsing contexts. Every operation is asynchronous; implementations decide
 * which thread actually talks to the browser.
 */
public interface SandboxPlatform {

    /**
     * Opens a sandbox and starts loading {@code url}. Lifecycle changes are reported to
     * {@code listener}, possibly before the returned future completes.
     */
    CompletableFuture<SandboxHandle> createSandbox(String sandboxId, String url, SandboxListener listener);

    CompletableFuture<Void> injectCode(SandboxHandle handle, String code, VisibilityLevel level);

    /** Idempotent: closing an unknown or already closed sandbox completes normally. */
    CompletableFuture<Void> closeSandbox(SandboxHandle handle);

    /** Subscribes to the sandbox's network events. Repeated calls keep a single subscription. */
    CompletableFuture<Void> observeNetwork(SandboxHandle handle, NetworkListener listener);

    /**
     * Exposes a named function to the page. Calls from any other sandbox are rejected.
     */
    CompletableFuture<Void> openChannel(SandboxHandle handle, String name, MessageListener listener);
}
