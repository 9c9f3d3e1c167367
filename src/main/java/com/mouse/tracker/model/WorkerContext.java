package com.mouse.tracker.model;

import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.WorkerStatus;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime state of one sandbox. Owned by the worker context manager; never persisted.
 * Collections are only reachable through the synchronized snapshot methods.
 */
public class WorkerContext {

    @Getter private final String sandboxId;
    @Getter private final String scheduleId;
    @Getter private final String targetId;
    @Getter private final String url;
    @Getter private final int index;
    @Getter private final Instant startedAt;
    @Getter private final HookSettings settings;
    @Getter private final CompletableFuture<WorkerOutcome> completion = new CompletableFuture<>();

    @Getter @Setter
    private volatile WorkerStatus status = WorkerStatus.LOADING;
    @Getter private volatile SandboxHandle handle;
    @Getter private volatile Instant lastHeartbeat;

    private final Map<String, CapturedExchange> exchanges = new LinkedHashMap<>();
    private final Set<HookLayer> readyLayers = EnumSet.noneOf(HookLayer.class);
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();
    private final List<String> logs = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean captureWindowStarted = new AtomicBoolean(false);
    private final AtomicBoolean tornDown = new AtomicBoolean(false);

    public WorkerContext(String sandboxId, String scheduleId, String targetId, String url,
                         int index, Instant startedAt, HookSettings settings) {
        this.sandboxId = Objects.requireNonNull(sandboxId, "sandboxId");
        this.scheduleId = scheduleId;
        this.targetId = targetId;
        this.url = url;
        this.index = index;
        this.startedAt = startedAt;
        this.lastHeartbeat = startedAt;
        this.settings = settings;
    }

    /** @return true if this call attached the handle */
    public synchronized boolean attach(SandboxHandle sandboxHandle) {
        if (handle != null || sandboxHandle == null) {
            return false;
        }
        handle = sandboxHandle;
        return true;
    }

    public void touch(Instant now) {
        lastHeartbeat = now;
    }

    /** @return true when every required layer has now reported ready */
    public synchronized boolean markLayerReady(HookLayer layer, Set<HookLayer> required) {
        if (layer == null) {
            return false;
        }
        readyLayers.add(layer);
        return readyLayers.containsAll(required);
    }

    public synchronized boolean isLayerReady(HookLayer layer) {
        return readyLayers.contains(layer);
    }

    public synchronized Set<HookLayer> readyLayerSnapshot() {
        return Set.copyOf(readyLayers);
    }

    public synchronized void recordExchange(CapturedExchange exchange) {
        exchanges.put(exchange.getId(), exchange);
    }

    public synchronized List<CapturedExchange> exchangeSnapshot() {
        return new ArrayList<>(exchanges.values());
    }

    public synchronized int getExchangeCount() {
        return exchanges.size();
    }

    public synchronized void addTimer(ScheduledFuture<?> timer) {
        if (tornDown.get()) {
            timer.cancel(false);
            return;
        }
        timers.add(timer);
    }

    public synchronized void cancelTimers() {
        timers.forEach(t -> t.cancel(false));
        timers.clear();
    }

    public void log(String line) {
        logs.add(line);
    }

    public List<String> logSnapshot() {
        synchronized (logs) {
            return new ArrayList<>(logs);
        }
    }

    public boolean startCaptureWindow() {
        return captureWindowStarted.compareAndSet(false, true);
    }

    /** @return true for the single caller allowed to tear this context down */
    public boolean beginTeardown() {
        return tornDown.compareAndSet(false, true);
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    public boolean isStalled(Instant now, long stallAfterMs) {
        Instant last = lastHeartbeat;
        return !status.isTerminal() && last != null && last.plusMillis(stallAfterMs).isBefore(now);
    }

    public String label() {
        return "#" + (index + 1) + " " + sandboxId;
    }
}
