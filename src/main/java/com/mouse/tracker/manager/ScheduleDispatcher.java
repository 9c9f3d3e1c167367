package com.mouse.tracker.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.entity.ExecutionRecord;
import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.entity.Target;
import com.mouse.tracker.enums.ScheduleKind;
import com.mouse.tracker.exception.InvalidScheduleException;
import com.mouse.tracker.exception.ScheduleNotFoundException;
import com.mouse.tracker.interfaces.TrackingStore;
import com.mouse.tracker.interfaces.WorkerLauncher;
import com.mouse.tracker.logservice.ExecutionLogService;
import com.mouse.tracker.model.DispatcherStatus;
import com.mouse.tracker.model.ExchangeSummary;
import com.mouse.tracker.model.ExecutionUpdate;
import com.mouse.tracker.model.WorkerContextView;
import com.mouse.tracker.model.WorkerOutcome;
import com.mouse.tracker.utils.ScheduleClock;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives schedules: on every tick it claims the due ones and fires each on the
 * {@code schedule-firing} pool, so a slow firing never delays the tick.
 * <p>
 * A firing opens {@code quantity} contexts, in batches when more than one, records the
 * outcome and advances the schedule. The claim guarantees a schedule never has two
 * overlapping firings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleDispatcher {

    private static final String EMOJI_TICK = "⏰";
    private static final String EMOJI_FIRE = "🔥";
    private static final String EMOJI_SKIP = "⏭️";
    private static final String EMOJI_ERROR = "❌";

    static final String ABANDONED_MESSAGE = "Abandoned: process stopped before completion";

    private final TrackingStore store;
    private final ScheduleClock scheduleClock;
    private final WorkerLauncher launcher;
    private final DispatcherState state;
    private final ExecutionLogService executionLog;
    private final TrackerConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicInteger firingThreadCounter = new AtomicInteger();
    private final ExecutorService firingExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "schedule-firing-" + firingThreadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastTickAt;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        reconcileAbandoned();
        if (config.isAutoStart()) {
            start();
        }
    }

    /** Start reacting to ticks. Safe to call multiple times. */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting ScheduleDispatcher | BatchSize: {} | InterBatchDelayMs: {} | Zone: {}",
                    config.getBatchSize(), config.getInterBatchDelayMs(), scheduleClock.getZone());
        } else {
            log.debug("ScheduleDispatcher start() called but already running");
        }
    }

    /** Stop reacting to ticks and force-close every running context. */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            int closed = launcher.closeAll();
            log.info("ScheduleDispatcher stopped | ContextsClosed: {}", closed);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        running.set(false);
        firingExecutor.shutdownNow();
    }

    @Scheduled(fixedDelayString = "${tracker.dispatcher.tick-ms:30000}",
            initialDelayString = "${tracker.dispatcher.initial-delay-ms:5000}")
    public void scheduledTick() {
        if (!running.get()) {
            return;
        }
        try {
            tick(clock.instant());
        } catch (Exception e) {
            log.error("{} Dispatcher tick failed: {}", EMOJI_ERROR, e.getMessage(), e);
        }
    }

    /**
     * Claims and fires every due schedule.
     *
     * @return one future per firing started, completing with the execution record id
     */
    public List<CompletableFuture<String>> tick(Instant now) {
        lastTickAt = now;
        List<Schedule> enabled = store.listEnabledSchedules();
        List<Schedule> due = enabled.stream().filter(s -> scheduleClock.isDue(s, now)).toList();

        log.debug("{} Tick | Enabled: {} | Due: {} | Claimed: {} | ActiveContexts: {}",
                EMOJI_TICK, enabled.size(), due.size(), state.claimedIds().size(), launcher.activeContexts().size());

        List<CompletableFuture<String>> firings = new ArrayList<>();
        for (Schedule schedule : due) {
            try {
                scheduleClock.validate(schedule);
            } catch (InvalidScheduleException e) {
                log.warn("{} Skipping invalid schedule | Schedule: {} | Reason: {}", EMOJI_SKIP, schedule.getId(), e.getMessage());
                continue;
            }
            tryFire(schedule, now, true).ifPresent(firings::add);
        }
        return firings;
    }

    /**
     * Fires a schedule now regardless of its next run, unless it is already firing.
     *
     * @return empty when the schedule is already claimed
     */
    public Optional<CompletableFuture<String>> forceExecute(String scheduleId) {
        Schedule schedule = store.getSchedule(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException("Schedule not found: " + scheduleId));
        scheduleClock.validate(schedule);
        log.info("Force executing schedule | Schedule: {}", scheduleId);
        return tryFire(schedule, clock.instant(), false);
    }

    public boolean checkScheduleNow(String scheduleId) {
        Schedule schedule = store.getSchedule(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException("Schedule not found: " + scheduleId));
        return scheduleClock.isDue(schedule, clock.instant());
    }

    public List<Schedule> upcoming(int limit) {
        return scheduleClock.upcoming(store.listEnabledSchedules(), clock.instant(), limit);
    }

    public DispatcherStatus status() {
        List<WorkerContextView> contexts = launcher.activeContexts();
        return DispatcherStatus.builder()
                .running(running.get())
                .lastTickAt(lastTickAt)
                .claimedScheduleIds(state.claimedIds())
                .activeContexts(contexts)
                .stalledContexts(contexts.stream().filter(WorkerContextView::isStalled).count())
                .build();
    }

    /**
     * Marks every record left without an end time by a previous process as failed.
     *
     * @return number of records finalized
     */
    public int reconcileAbandoned() {
        List<ExecutionRecord> unfinished = store.listUnfinishedExecutionRecords();
        Instant now = clock.instant();
        for (ExecutionRecord record : unfinished) {
            List<String> logs = new ArrayList<>(record.getLogs() == null ? List.of() : record.getLogs());
            logs.add("[" + now + "] " + ABANDONED_MESSAGE);
            store.updateExecutionRecord(record.getId(), ExecutionUpdate.builder()
                    .endTime(now)
                    .success(false)
                    .errorMessage(ABANDONED_MESSAGE)
                    .logs(logs)
                    .build());
        }
        if (!unfinished.isEmpty()) {
            log.warn("Finalized abandoned execution records | Count: {}", unfinished.size());
        }
        return unfinished.size();
    }

    // ==================== FIRING ====================

    /**
     * Claims the schedule, then re-reads it so a firing that finished after the caller's
     * read cannot be repeated from stale data.
     *
     * @param requireDue whether the fresh copy must still be enabled and due
     */
    private Optional<CompletableFuture<String>> tryFire(Schedule candidate, Instant now, boolean requireDue) {
        if (!state.tryClaim(candidate.getId(), now)) {
            log.debug("{} Schedule already firing | Schedule: {}", EMOJI_SKIP, candidate.getId());
            return Optional.empty();
        }

        Schedule schedule;
        String recordId;
        try {
            Optional<Schedule> current = store.getSchedule(candidate.getId());
            if (current.isEmpty() || (requireDue && !scheduleClock.isDue(current.get(), now))) {
                log.debug("{} Schedule no longer due after claim | Schedule: {}", EMOJI_SKIP, candidate.getId());
                state.release(candidate.getId());
                return Optional.empty();
            }
            schedule = current.get();
            recordId = store.createExecutionRecord(ExecutionRecord.builder()
                    .targetId(schedule.getTargetId())
                    .scheduleId(schedule.getId())
                    .startTime(now)
                    .success(false)
                    .logs(new ArrayList<>(List.of("[" + now + "] Started execution")))
                    .build());
        } catch (Exception e) {
            log.error("{} Cannot create execution record | Schedule: {} | Error: {}", EMOJI_ERROR, candidate.getId(), e.getMessage());
            state.release(candidate.getId());
            return Optional.empty();
        }

        log.info("{} Firing schedule | Schedule: {} | Timing: {} | Quantity: {} | Record: {}",
                EMOJI_FIRE, schedule.getId(), schedule.describeTiming(), schedule.getQuantity(), recordId);

        try {
            return Optional.of(CompletableFuture.supplyAsync(() -> runFiring(schedule, recordId, now), firingExecutor));
        } catch (RuntimeException e) {
            log.error("{} Firing rejected | Schedule: {} | Error: {}", EMOJI_ERROR, schedule.getId(), e.getMessage());
            failRecord(recordId, new ArrayList<>(), "Firing rejected: " + e.getMessage());
            state.release(schedule.getId());
            return Optional.empty();
        }
    }

    private String runFiring(Schedule schedule, String recordId, Instant startedAt) {
        state.markFiring(schedule.getId());
        List<String> logs = new ArrayList<>();
        logs.add("[" + startedAt + "] Started execution");
        try {
            Target target = store.getTarget(schedule.getTargetId());
            if (!target.isEnabled()) {
                throw new IllegalStateException("Target " + target.getId() + " is disabled");
            }
            logs.add(executionLog.firingStarted(schedule, target));

            List<WorkerOutcome> outcomes = runContexts(target, schedule, logs);
            finalizeRecord(schedule, recordId, outcomes, logs, startedAt);
        } catch (Exception e) {
            logs.add(executionLog.firingFailed(schedule, e.getMessage(), e));
            failRecord(recordId, logs, e.getMessage());
        } finally {
            advance(schedule);
            state.release(schedule.getId());
        }
        return recordId;
    }

    private List<WorkerOutcome> runContexts(Target target, Schedule schedule, List<String> logs) {
        int quantity = Math.max(1, schedule.getQuantity());
        List<WorkerOutcome> outcomes = new ArrayList<>(quantity);

        if (quantity == 1) {
            WorkerOutcome outcome = launchSafely(target, schedule, 0).join();
            logs.addAll(outcome.getLogs());
            logs.add(executionLog.contextFinished(schedule, outcome));
            outcomes.add(outcome);
            return outcomes;
        }

        int batchSize = Math.min(quantity, Math.max(1, config.getBatchSize()));
        int totalBatches = (quantity + batchSize - 1) / batchSize;
        for (int start = 0, batch = 1; start < quantity; start += batchSize, batch++) {
            int end = Math.min(start + batchSize, quantity);
            logs.add(executionLog.batchStarted(schedule, batch, totalBatches, end - start));

            List<CompletableFuture<WorkerOutcome>> running = new ArrayList<>();
            for (int index = start; index < end; index++) {
                running.add(launchSafely(target, schedule, index));
            }
            CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();

            for (CompletableFuture<WorkerOutcome> future : running) {
                WorkerOutcome outcome = future.join();
                logs.addAll(outcome.getLogs());
                logs.add(executionLog.contextFinished(schedule, outcome));
                outcomes.add(outcome);
            }

            if (end < quantity) {
                pauseBetweenBatches();
            }
        }
        return outcomes;
    }

    /** Never completes exceptionally: launch failures become failed outcomes. */
    private CompletableFuture<WorkerOutcome> launchSafely(Target target, Schedule schedule, int index) {
        try {
            CompletableFuture<WorkerOutcome> future = launcher.launch(target, schedule, index);
            if (future == null) {
                return CompletableFuture.completedFuture(WorkerOutcome.failed(index, "Launcher returned no result"));
            }
            return future.exceptionally(t -> WorkerOutcome.failed(index, rootMessage(t)));
        } catch (Exception e) {
            log.error("{} Context launch failed | Schedule: {} | Index: {} | Error: {}",
                    EMOJI_ERROR, schedule.getId(), index, e.getMessage());
            return CompletableFuture.completedFuture(WorkerOutcome.failed(index, e.getMessage()));
        }
    }

    private void pauseBetweenBatches() {
        long delay = config.getInterBatchDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void finalizeRecord(Schedule schedule, String recordId, List<WorkerOutcome> outcomes,
                                List<String> logs, Instant startedAt) {
        int successful = (int) outcomes.stream().filter(WorkerOutcome::isSuccess).count();
        int exchanges = outcomes.stream().mapToInt(o -> o.getExchanges().size()).sum();
        boolean success = successful > 0 || exchanges > 0;

        List<String> errors = outcomes.stream()
                .filter(o -> !o.isSuccess() && o.getError() != null)
                .map(o -> "Context " + (o.getIndex() + 1) + ": " + o.getError())
                .toList();

        logs.add(executionLog.firingFinished(schedule, success, successful, outcomes.size(), exchanges, startedAt));

        store.updateExecutionRecord(recordId, ExecutionUpdate.builder()
                .endTime(clock.instant())
                .success(success)
                .errorMessage(success ? null : (errors.isEmpty() ? "No context succeeded" : String.join("; ", errors)))
                .logs(logs)
                .executionData(executionData(outcomes, successful, exchanges, errors))
                .build());
    }

    private void failRecord(String recordId, List<String> logs, String reason) {
        try {
            store.updateExecutionRecord(recordId, ExecutionUpdate.builder()
                    .endTime(clock.instant())
                    .success(false)
                    .errorMessage(reason == null ? "Unknown error" : reason)
                    .logs(logs)
                    .build());
        } catch (Exception e) {
            log.error("{} Cannot finalize execution record | Record: {} | Error: {}", EMOJI_ERROR, recordId, e.getMessage());
        }
    }

    /** Once schedules are disabled after their firing; the others move to their next run. */
    private void advance(Schedule schedule) {
        try {
            if (schedule.getKind() == ScheduleKind.ONCE) {
                store.disableSchedule(schedule.getId());
                log.info("One-time schedule disabled | Schedule: {}", schedule.getId());
                return;
            }
            Instant nextRun = scheduleClock.computeNextRun(schedule, clock.instant());
            store.updateScheduleNextRun(schedule.getId(), nextRun);
            log.debug("Next run scheduled | Schedule: {} | NextRun: {}", schedule.getId(), nextRun);
        } catch (Exception e) {
            log.error("{} Cannot advance schedule | Schedule: {} | Error: {}", EMOJI_ERROR, schedule.getId(), e.getMessage());
        }
    }

    private String executionData(List<WorkerOutcome> outcomes, int successful, int exchanges, List<String> errors) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("processed", outcomes.size());
        data.put("successful", successful);
        data.put("failed", outcomes.size() - successful);
        data.put("exchanges", exchanges);

        List<Map<String, Object>> results = new ArrayList<>();
        List<Object> payloads = new ArrayList<>();
        for (WorkerOutcome outcome : outcomes) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("index", outcome.getIndex());
            result.put("sandboxId", outcome.getSandboxId());
            result.put("status", outcome.getStatus());
            result.put("success", outcome.isSuccess());
            result.put("error", outcome.getError());
            result.put("discardedExchanges", outcome.getDiscardedExchanges());
            result.put("exchanges", outcome.getExchanges().stream().map(ExchangeSummary::of).toList());
            results.add(result);

            outcome.getExchanges().stream()
                    .map(CapturedExchange::getExtractedPayload)
                    .filter(Objects::nonNull)
                    .map(this::readPayload)
                    .forEach(payloads::add);
        }
        data.put("results", results);
        data.put("payloads", payloads);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("successRate", outcomes.isEmpty() ? "0%"
                : String.format("%.1f%%", successful * 100.0 / outcomes.size()));
        summary.put("errors", errors);
        data.put("summary", summary);

        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize execution data: {}", e.getMessage());
            return null;
        }
    }

    private Object readPayload(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return payload;
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
