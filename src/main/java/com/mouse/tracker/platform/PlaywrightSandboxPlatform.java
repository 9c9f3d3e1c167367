package com.mouse.tracker.platform;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Request;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.enums.LoadState;
import com.mouse.tracker.enums.VisibilityLevel;
import com.mouse.tracker.exception.SandboxException;
import com.mouse.tracker.interfaces.MessageListener;
import com.mouse.tracker.interfaces.NetworkListener;
import com.mouse.tracker.interfaces.SandboxListener;
import com.mouse.tracker.interfaces.SandboxPlatform;
import com.mouse.tracker.model.NetworkEvent;
import com.mouse.tracker.model.SandboxHandle;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Sandboxes backed by one headless Chromium: a fresh browser context plus page per sandbox.
 * <p>
 * Playwright objects are not thread safe, so every call runs on the single
 * {@code playwright-driver} thread. Playwright only dispatches events while a call is in
 * flight on that thread, hence the pump task that keeps it busy with short waits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightSandboxPlatform implements SandboxPlatform {

    private static final String EMOJI_BROWSER = "🌐";
    private static final String EMOJI_ERROR = "❌";

    private final TrackerConfig config;
    private final BrowserManager browserManager;

    private final ExecutorService driver = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "playwright-driver");
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService pump = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "playwright-pump");
        t.setDaemon(true);
        return t;
    });

    private final Map<String, Sandbox> sandboxes = new ConcurrentHashMap<>();
    private final AtomicBoolean pumpScheduled = new AtomicBoolean(false);
    private final AtomicBoolean pumpQueued = new AtomicBoolean(false);
    private final AtomicLong requestCounter = new AtomicLong();

    // driver thread only
    private Playwright playwright;
    private Browser browser;

    @Override
    public CompletableFuture<SandboxHandle> createSandbox(String sandboxId, String url, SandboxListener listener) {
        return CompletableFuture.supplyAsync(() -> {
            ensureBrowser();
            startPump();

            BrowserContext context = browser.newContext(browserManager.createContextOptions());
            Page page;
            try {
                page = context.newPage();
            } catch (PlaywrightException e) {
                safeClose(context);
                throw new SandboxException("Failed to open page for sandbox " + sandboxId, e);
            }

            SandboxHandle handle = new SandboxHandle(sandboxId, url);
            Sandbox sandbox = new Sandbox(handle, context, page);
            sandboxes.put(sandboxId, sandbox);
            wireLifecycle(sandbox, listener);

            try {
                page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.COMMIT)
                        .setTimeout(config.getNavigationTimeoutMs()));
            } catch (PlaywrightException e) {
                sandboxes.remove(sandboxId);
                sandbox.closed = true;
                safeClose(context);
                throw new SandboxException("Navigation failed | Sandbox: " + sandboxId + " | Url: " + url, e);
            }

            log.info("{} Sandbox opened | Id: {} | Url: {} | Open: {}", EMOJI_BROWSER, sandboxId, url, sandboxes.size());
            return handle;
        }, driver);
    }

    @Override
    public CompletableFuture<Void> injectCode(SandboxHandle handle, String code, VisibilityLevel level) {
        return CompletableFuture.runAsync(() -> {
            Sandbox sandbox = require(handle);
            if (level == VisibilityLevel.PAGE && sandbox.initScripts.add(code.hashCode())) {
                sandbox.page.addInitScript(code);
            }
            sandbox.page.evaluate(code);
        }, driver);
    }

    @Override
    public CompletableFuture<Void> closeSandbox(SandboxHandle handle) {
        return CompletableFuture.runAsync(() -> {
            Sandbox sandbox = sandboxes.remove(handle.getSandboxId());
            if (sandbox == null) {
                log.debug("Sandbox already closed | Id: {}", handle.getSandboxId());
                return;
            }
            sandbox.closed = true;
            safeClose(sandbox.context);
            log.info("{} Sandbox closed | Id: {} | Open: {}", EMOJI_BROWSER, handle.getSandboxId(), sandboxes.size());
        }, driver);
    }

    @Override
    public CompletableFuture<Void> observeNetwork(SandboxHandle handle, NetworkListener listener) {
        return CompletableFuture.runAsync(() -> {
            Sandbox sandbox = require(handle);
            if (sandbox.networkObserved) {
                return;
            }
            sandbox.networkObserved = true;

            Page page = sandbox.page;
            page.onRequest(request -> deliver(handle, listener, requestEvent(sandbox, request)));
            page.onResponse(response -> deliver(handle, listener, responseEvent(sandbox, response)));
            page.onRequestFailed(request -> deliver(handle, listener, failureEvent(sandbox, request)));
        }, driver);
    }

    @Override
    public CompletableFuture<Void> openChannel(SandboxHandle handle, String name, MessageListener listener) {
        return CompletableFuture.runAsync(() -> {
            Sandbox sandbox = require(handle);
            if (!sandbox.channels.add(name)) {
                return;
            }
            sandbox.page.exposeBinding(name, (source, args) -> {
                if (source.page() != sandbox.page) {
                    log.warn("Rejected channel message from foreign page | Channel: {} | Sandbox: {}", name, handle.getSandboxId());
                    return null;
                }
                listener.onMessage(handle, args.length > 0 && args[0] != null ? String.valueOf(args[0]) : null);
                return null;
            });
        }, driver);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down sandbox platform | Open sandboxes: {}", sandboxes.size());
        pump.shutdownNow();
        try {
            driver.submit(() -> {
                sandboxes.values().forEach(s -> {
                    s.closed = true;
                    safeClose(s.context);
                });
                sandboxes.clear();
                safeClose(browser);
                safeClose(playwright);
                browser = null;
                playwright = null;
            }).get(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.warn("Playwright shutdown incomplete: {}", e.getMessage());
        } finally {
            driver.shutdownNow();
        }
    }

    // ==================== DRIVER THREAD ====================

    private void ensureBrowser() {
        if (browser != null && browser.isConnected()) {
            return;
        }
        if (playwright == null) {
            playwright = Playwright.create();
        }
        browser = playwright.chromium().launch(browserManager.createLaunchOptions());
        log.info("{} Browser launched | Headless: {} | Version: {}", EMOJI_BROWSER, config.isHeadless(), browser.version());
    }

    private void wireLifecycle(Sandbox sandbox, SandboxListener listener) {
        Page page = sandbox.page;
        SandboxHandle handle = sandbox.handle;

        page.onRequest(request -> {
            if (request.isNavigationRequest() && request.frame() == page.mainFrame()) {
                notifyLoadState(listener, handle, LoadState.LOADING);
            }
        });
        page.onDOMContentLoaded(p -> notifyLoadState(listener, handle, LoadState.DOM_READY));
        page.onLoad(p -> notifyLoadState(listener, handle, LoadState.COMPLETE));
        page.onClose(p -> notifyRemoved(sandbox, listener, "page closed"));
        page.onCrash(p -> notifyRemoved(sandbox, listener, "page crashed"));
    }

    private void notifyLoadState(SandboxListener listener, SandboxHandle handle, LoadState state) {
        try {
            listener.onLoadStateChanged(handle, state);
        } catch (RuntimeException e) {
            log.error("{} Load state listener failed | Sandbox: {} | State: {} | Error: {}",
                    EMOJI_ERROR, handle.getSandboxId(), state, e.getMessage());
        }
    }

    private void notifyRemoved(Sandbox sandbox, SandboxListener listener, String reason) {
        if (sandbox.closed) {
            return;
        }
        sandbox.closed = true;
        sandboxes.remove(sandbox.handle.getSandboxId());
        log.warn("Sandbox removed externally | Id: {} | Reason: {}", sandbox.handle.getSandboxId(), reason);
        try {
            listener.onRemoved(sandbox.handle);
        } catch (RuntimeException e) {
            log.error("{} Removal listener failed | Sandbox: {} | Error: {}", EMOJI_ERROR, sandbox.handle.getSandboxId(), e.getMessage());
        }
    }

    private void deliver(SandboxHandle handle, NetworkListener listener, NetworkEvent event) {
        try {
            listener.onNetworkEvent(handle, event);
        } catch (RuntimeException e) {
            log.error("{} Network listener failed | Sandbox: {} | Url: {} | Error: {}",
                    EMOJI_ERROR, handle.getSandboxId(), event.getUrl(), e.getMessage());
        }
    }

    private NetworkEvent requestEvent(Sandbox sandbox, Request request) {
        return NetworkEvent.builder()
                .phase(NetworkEvent.Phase.REQUEST)
                .requestId(sandbox.requestId(request, requestCounter))
                .url(request.url())
                .method(request.method())
                .requestHeaders(request.headers())
                .requestBody(safePostData(request))
                .timestamp(System.currentTimeMillis())
                .build();
    }

    private NetworkEvent responseEvent(Sandbox sandbox, Response response) {
        Request request = response.request();
        Supplier<String> body = response::text;
        return NetworkEvent.builder()
                .phase(NetworkEvent.Phase.RESPONSE)
                .requestId(sandbox.requestId(request, requestCounter))
                .url(response.url())
                .method(request.method())
                .status(response.status())
                .statusText(response.statusText())
                .responseHeaders(response.headers())
                .timestamp(System.currentTimeMillis())
                .bodyReader(body)
                .build();
    }

    private NetworkEvent failureEvent(Sandbox sandbox, Request request) {
        return NetworkEvent.builder()
                .phase(NetworkEvent.Phase.FAILED)
                .requestId(sandbox.requestId(request, requestCounter))
                .url(request.url())
                .method(request.method())
                .failure(request.failure())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    private static String safePostData(Request request) {
        try {
            return request.postData();
        } catch (PlaywrightException e) {
            return null;
        }
    }

    private Sandbox require(SandboxHandle handle) {
        Sandbox sandbox = sandboxes.get(handle.getSandboxId());
        if (sandbox == null || sandbox.closed) {
            throw new SandboxException("Sandbox is not open: " + handle.getSandboxId());
        }
        return sandbox;
    }

    private void startPump() {
        if (!pumpScheduled.compareAndSet(false, true)) {
            return;
        }
        long period = Math.max(10, config.getEventPumpMs());
        pump.scheduleWithFixedDelay(() -> {
            if (sandboxes.isEmpty() || !pumpQueued.compareAndSet(false, true)) {
                return;
            }
            driver.execute(this::dispatchEvents);
        }, period, period, TimeUnit.MILLISECONDS);
    }

    private void dispatchEvents() {
        try {
            for (Sandbox sandbox : sandboxes.values()) {
                if (!sandbox.closed && !sandbox.page.isClosed()) {
                    sandbox.page.waitForTimeout(1);
                    return;
                }
            }
        } catch (PlaywrightException e) {
            log.debug("Event pump interrupted: {}", e.getMessage());
        } finally {
            pumpQueued.set(false);
        }
    }

    private void safeClose(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Close failed, treating as already closed: {}", e.getMessage());
        }
    }

    private static final class Sandbox {
        private final SandboxHandle handle;
        private final BrowserContext context;
        private final Page page;
        private final Set<Integer> initScripts = new HashSet<>();
        private final Set<String> channels = new HashSet<>();
        private final Map<Request, String> requestIds = new WeakHashMap<>();
        private volatile boolean closed;
        private boolean networkObserved;

        private Sandbox(SandboxHandle handle, BrowserContext context, Page page) {
            this.handle = handle;
            this.context = context;
            this.page = page;
        }

        private String requestId(Request request, AtomicLong counter) {
            return requestIds.computeIfAbsent(request, r -> handle.getSandboxId() + "-" + counter.incrementAndGet());
        }
    }
}
