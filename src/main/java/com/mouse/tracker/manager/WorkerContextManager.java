package com.mouse.tracker.manager;

import com.mouse.tracker.bridge.InterceptionBridge;
import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.entity.Target;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.LoadState;
import com.mouse.tracker.enums.VisibilityLevel;
import com.mouse.tracker.enums.WorkerEvent;
import com.mouse.tracker.enums.WorkerStatus;
import com.mouse.tracker.interfaces.InterceptionHook;
import com.mouse.tracker.interfaces.SandboxListener;
import com.mouse.tracker.interfaces.SandboxPlatform;
import com.mouse.tracker.interfaces.WorkerLauncher;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.model.HookSettings;
import com.mouse.tracker.model.SandboxHandle;
import com.mouse.tracker.model.WorkerContext;
import com.mouse.tracker.model.WorkerContextView;
import com.mouse.tracker.model.WorkerOutcome;
import com.mouse.tracker.utils.IdGenerator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the lifecycle of every sandbox opened for a firing.
 * <p>
 * Status changes go through {@link WorkerStateMachine}. Hook messages and platform
 * callbacks are handed to the single {@code interception-bridge} thread; timers run on
 * {@code worker-timer} threads. Each context is torn down exactly once, whichever of
 * completion, timeout, failure or external removal comes first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerContextManager implements WorkerLauncher {

    private static final String EMOJI_START = "🚀";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";

    private static final String CHANNEL_PREFIX = "__apiTrackerRelay_";

    private final SandboxPlatform platform;
    private final InterceptionBridge bridge;
    private final List<InterceptionHook> hooks;
    private final WorkerRegistry registry;
    private final TrackerConfig config;
    private final Clock clock;

    private final AtomicInteger timerThreadCounter = new AtomicInteger();
    private final ScheduledExecutorService timers = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "worker-timer-" + timerThreadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService events = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "interception-bridge");
        t.setDaemon(true);
        return t;
    });

    private Semaphore slots;
    private Set<HookLayer> requiredLayers;

    @PostConstruct
    public void init() {
        int max = config.getGlobalMaxContexts();
        slots = max > 0 ? new Semaphore(max, true) : null;
        requiredLayers = EnumSet.noneOf(HookLayer.class);
        hooks.forEach(h -> requiredLayers.add(h.layer()));
        log.info("Worker context manager ready | Hooks: {} | GlobalMaxContexts: {} | TimeoutMs: {} | CaptureWindowMs: {}",
                requiredLayers, max > 0 ? max : "unlimited", config.getWorkerTimeoutMs(), config.getCaptureWindowMs());
    }

    @PreDestroy
    public void shutdown() {
        closeAll();
        timers.shutdownNow();
        events.shutdown();
        try {
            if (!events.awaitTermination(5, TimeUnit.SECONDS)) {
                events.shutdownNow();
            }
        } catch (InterruptedException e) {
            events.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public CompletableFuture<WorkerOutcome> launch(Target target, Schedule schedule, int index) {
        if (!acquireSlot()) {
            return CompletableFuture.completedFuture(
                    WorkerOutcome.failed(index, "Interrupted while waiting for a free context slot"));
        }

        String sandboxId = IdGenerator.sandboxId();
        Instant now = clock.instant();
        HookSettings settings = HookSettings.builder()
                .sandboxId(sandboxId)
                .scheduleId(schedule.getId())
                .targetId(target.getId())
                .pattern(config.getTrackingPattern())
                .alternates(new ArrayList<>(config.getAlternatePatterns()))
                .extractionPath(config.getExtractionPath())
                .channel(CHANNEL_PREFIX + sandboxId.replaceAll("[^A-Za-z0-9_]", "_"))
                .heartbeatMs(config.getHeartbeatMs())
                .build();

        WorkerContext ctx = new WorkerContext(sandboxId, schedule.getId(), target.getId(), target.getUrl(),
                index, now, settings);
        try {
            registry.register(ctx);
            bridge.openSession(sandboxId, schedule.getId());
            ctx.addTimer(timers.schedule(
                    () -> submit(ctx, () -> apply(ctx, WorkerEvent.TIMEOUT,
                            "Timed out after " + config.getWorkerTimeoutMs() + " ms in " + ctx.getStatus())),
                    config.getWorkerTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (RuntimeException e) {
            // nothing is running yet; undo the registration
            bridge.flush(sandboxId);
            registry.remove(sandboxId);
            releaseSlot();
            log.error("{} Context setup failed | Schedule: {} | Context: {} | Error: {}",
                    EMOJI_ERROR, schedule.getId(), ctx.label(), rootMessage(e));
            return CompletableFuture.completedFuture(
                    WorkerOutcome.failed(index, "Context setup failed: " + rootMessage(e)));
        }
        ctx.log("Context " + (index + 1) + " opening " + target.getUrl());
        log.info("{} Launching context | Schedule: {} | Context: {} | Url: {}",
                EMOJI_START, schedule.getId(), ctx.label(), target.getUrl());

        try {
            platform.createSandbox(sandboxId, target.getUrl(), new ContextListener(ctx))
                    .whenComplete((handle, err) -> submit(ctx, () -> onSandboxCreated(ctx, handle, err)));
        } catch (RuntimeException e) {
            submit(ctx, () -> apply(ctx, WorkerEvent.FAILURE, "Sandbox creation failed: " + rootMessage(e)));
        }
        return ctx.getCompletion();
    }

    @Override
    public int closeScheduleContexts(String scheduleId) {
        List<WorkerContext> contexts = registry.bySchedule(scheduleId);
        contexts.forEach(ctx -> submit(ctx, () -> apply(ctx, WorkerEvent.SANDBOX_REMOVED, "Closed on request")));
        if (!contexts.isEmpty()) {
            log.info("Closing contexts on request | Schedule: {} | Count: {}", scheduleId, contexts.size());
        }
        return contexts.size();
    }

    @Override
    public int closeAll() {
        List<WorkerContext> contexts = registry.all();
        contexts.forEach(ctx -> submit(ctx, () -> apply(ctx, WorkerEvent.SANDBOX_REMOVED, "Closed on request")));
        if (!contexts.isEmpty()) {
            log.info("Closing all contexts | Count: {}", contexts.size());
        }
        return contexts.size();
    }

    @Override
    public List<WorkerContextView> activeContexts() {
        Instant now = clock.instant();
        return registry.all().stream()
                .map(ctx -> WorkerContextView.of(ctx, now, config.getStallAfterMs()))
                .toList();
    }

    // ==================== EVENT HANDLING (interception-bridge thread) ====================

    private void onSandboxCreated(WorkerContext ctx, SandboxHandle handle, Throwable err) {
        if (err != null) {
            apply(ctx, WorkerEvent.FAILURE, "Sandbox creation failed: " + rootMessage(err));
            return;
        }
        ctx.attach(handle);
        if (ctx.isTornDown()) {
            // finished while the sandbox was still being created
            closeSandbox(handle);
        }
    }

    private void onLoadState(WorkerContext ctx, SandboxHandle handle, LoadState state) {
        ctx.attach(handle);
        ctx.touch(clock.instant());
        log.debug("Load state | Context: {} | State: {}", ctx.label(), state);
        apply(ctx, WorkerEvent.LOAD_STARTED, null);
    }

    void handleHookMessage(WorkerContext ctx, HookMessage message) {
        if (ctx.isTornDown() || message == null || message.getType() == null) {
            return;
        }
        ctx.touch(clock.instant());

        switch (message.getType()) {
            case READY -> {
                if (ctx.isLayerReady(message.getLayer())) {
                    return;
                }
                boolean allReady = ctx.markLayerReady(message.getLayer(), requiredLayers);
                log.debug("Hook ready | Context: {} | Layer: {}", ctx.label(), message.getLayer());
                if (allReady) {
                    apply(ctx, WorkerEvent.HOOKS_READY, null);
                }
            }
            case HEARTBEAT -> {
                // lastHeartbeat already updated
            }
            default -> bridge.accept(ctx.getSandboxId(), message).ifPresent(exchange -> onExchange(ctx, exchange));
        }
    }

    private void onExchange(WorkerContext ctx, CapturedExchange exchange) {
        ctx.recordExchange(exchange);
        apply(ctx, WorkerEvent.EXCHANGE_CAPTURED, null);
        if (config.isCompleteOnPayload() && exchange.hasPayload()) {
            ctx.log("Payload captured from " + exchange.getUrl());
            apply(ctx, WorkerEvent.CAPTURE_WINDOW_ELAPSED, "Payload captured");
        }
    }

    void apply(WorkerContext ctx, WorkerEvent event, String detail) {
        WorkerStatus before;
        WorkerStatus after;
        synchronized (ctx) {
            before = ctx.getStatus();
            after = WorkerStateMachine.next(before, event);
            if (after == before) {
                return;
            }
            ctx.setStatus(after);
        }

        log.debug("Context transition | Context: {} | {} -> {} | Event: {}", ctx.label(), before, after, event);
        switch (after) {
            case INJECTING -> scheduleInjection(ctx);
            case READY, TRACKING -> startCaptureWindow(ctx);
            case COMPLETED, ERROR, TIMED_OUT -> teardown(ctx, after, event, detail);
            default -> {
            }
        }
    }

    private void scheduleInjection(WorkerContext ctx) {
        List<Long> delays = config.getInjectionDelaysMs();
        for (int i = 0; i < delays.size(); i++) {
            int attempt = i + 1;
            ctx.addTimer(timers.schedule(() -> submit(ctx, () -> attemptInjection(ctx, attempt)),
                    Math.max(0, delays.get(i)), TimeUnit.MILLISECONDS));
        }
    }

    private void attemptInjection(WorkerContext ctx, int attempt) {
        SandboxHandle handle = ctx.getHandle();
        if (ctx.isTornDown() || ctx.getStatus() != WorkerStatus.INJECTING || handle == null) {
            return;
        }
        if (requiredLayers.stream().allMatch(ctx::isLayerReady)) {
            // hooks reported ready before the load event
            apply(ctx, WorkerEvent.HOOKS_READY, null);
            return;
        }

        log.debug("Injection attempt {} | Context: {}", attempt, ctx.label());
        CompletableFuture<Void> chain = platform.injectCode(handle, ctx.getSettings().toSettingsScript(), VisibilityLevel.ISOLATED);
        for (InterceptionHook hook : hooks) {
            if (!ctx.isLayerReady(hook.layer())) {
                chain = chain.thenCompose(v -> hook.install(handle, ctx.getSettings(),
                        message -> submit(ctx, () -> handleHookMessage(ctx, message))));
            }
        }
        chain.whenComplete((v, err) -> {
            if (err != null) {
                // injection races with navigation; later attempts retry
                log.debug("Injection attempt {} failed | Context: {} | Reason: {}", attempt, ctx.label(), rootMessage(err));
            }
        });
    }

    private void startCaptureWindow(WorkerContext ctx) {
        if (!ctx.startCaptureWindow()) {
            return;
        }
        ctx.log("Context " + (ctx.getIndex() + 1) + " tracking for up to " + config.getCaptureWindowMs() + " ms");
        ctx.addTimer(timers.schedule(
                () -> submit(ctx, () -> apply(ctx, WorkerEvent.CAPTURE_WINDOW_ELAPSED, "Capture window elapsed")),
                config.getCaptureWindowMs(), TimeUnit.MILLISECONDS));
    }

    private void teardown(WorkerContext ctx, WorkerStatus status, WorkerEvent cause, String detail) {
        if (!ctx.beginTeardown()) {
            return;
        }
        ctx.cancelTimers();
        int discarded = bridge.flush(ctx.getSandboxId());
        registry.remove(ctx.getSandboxId());
        releaseSlot();

        SandboxHandle handle = ctx.getHandle();
        if (handle != null) {
            closeSandbox(handle);
        }

        List<CapturedExchange> exchanges = ctx.exchangeSnapshot();
        boolean success = WorkerOutcome.isSuccessful(status, exchanges.size());
        String error = success ? null : errorFor(status, cause, detail, exchanges.size());

        ctx.log(String.format("Context %d finished | Status: %s | Exchanges: %d%s",
                ctx.getIndex() + 1, status, exchanges.size(), detail == null ? "" : " | " + detail));

        WorkerOutcome outcome = WorkerOutcome.builder()
                .sandboxId(ctx.getSandboxId())
                .index(ctx.getIndex())
                .status(status)
                .success(success)
                .exchanges(exchanges)
                .error(error)
                .startedAt(ctx.getStartedAt())
                .finishedAt(clock.instant())
                .discardedExchanges(discarded)
                .logs(ctx.logSnapshot())
                .build();

        if (success) {
            log.info("{} Context finished | Context: {} | Status: {} | Exchanges: {} | Payloads: {}",
                    EMOJI_SUCCESS, ctx.label(), status, exchanges.size(), outcome.getPayloadCount());
        } else {
            log.warn("{} Context finished | Context: {} | Status: {} | Reason: {}",
                    status == WorkerStatus.ERROR ? EMOJI_ERROR : EMOJI_WARNING, ctx.label(), status, error);
        }
        ctx.getCompletion().complete(outcome);
    }

    private String errorFor(WorkerStatus status, WorkerEvent cause, String detail, int exchanges) {
        if (detail != null) {
            return detail;
        }
        if (status == WorkerStatus.TIMED_OUT) {
            return "Timed out with " + exchanges + " exchanges";
        }
        return "Context ended by " + cause;
    }

    private void closeSandbox(SandboxHandle handle) {
        platform.closeSandbox(handle).whenComplete((v, err) -> {
            if (err != null) {
                log.debug("Sandbox close reported an error, treating as closed | Id: {} | Reason: {}",
                        handle.getSandboxId(), rootMessage(err));
            }
        });
    }

    private void submit(WorkerContext ctx, Runnable task) {
        try {
            events.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("{} Context event failed | Context: {} | Error: {}", EMOJI_ERROR, ctx.label(), e.getMessage(), e);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Event executor rejected task | Context: {} | Reason: {}", ctx.label(), e.getMessage());
        }
    }

    private boolean acquireSlot() {
        if (slots == null) {
            return true;
        }
        try {
            slots.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void releaseSlot() {
        if (slots != null) {
            slots.release();
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private final class ContextListener implements SandboxListener {
        private final WorkerContext ctx;

        private ContextListener(WorkerContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public void onLoadStateChanged(SandboxHandle handle, LoadState state) {
            submit(ctx, () -> onLoadState(ctx, handle, state));
        }

        @Override
        public void onRemoved(SandboxHandle handle) {
            submit(ctx, () -> {
                ctx.attach(handle);
                apply(ctx, WorkerEvent.SANDBOX_REMOVED, "Sandbox closed externally");
            });
        }
    }
}
