package com.mouse.tracker.logservice;

import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.entity.Target;
import com.mouse.tracker.model.WorkerOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Logs the milestones of a firing and returns the same line for the execution record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLogService {

    private final Clock clock;

    /** Call when a firing begins. */
    public String firingStarted(Schedule schedule, Target target) {
        String line = String.format("Started %s | Target: %s | Url: %s | Timing: %s | Quantity: %d",
                schedule.getName() == null ? schedule.getId() : schedule.getName(),
                target.getName(), target.getUrl(), schedule.describeTiming(), schedule.getQuantity());
        log.info("FIRING START | schedule={} {}", schedule.getId(), line);
        return stamp(line);
    }

    public String batchStarted(Schedule schedule, int batchNumber, int totalBatches, int size) {
        String line = String.format("Batch %d/%d | Contexts: %d", batchNumber, totalBatches, size);
        log.info("BATCH | schedule={} {}", schedule.getId(), line);
        return stamp(line);
    }

    public String contextFinished(Schedule schedule, WorkerOutcome outcome) {
        String line = String.format("Context %d %s | Status: %s | Exchanges: %d | Payloads: %d%s",
                outcome.getIndex() + 1,
                outcome.isSuccess() ? "succeeded" : "failed",
                outcome.getStatus(),
                outcome.getExchanges().size(),
                outcome.getPayloadCount(),
                outcome.getError() == null ? "" : " | Error: " + outcome.getError());
        if (outcome.isSuccess()) {
            log.info("CONTEXT | schedule={} sandbox={} {}", schedule.getId(), outcome.getSandboxId(), line);
        } else {
            log.warn("CONTEXT | schedule={} sandbox={} {}", schedule.getId(), outcome.getSandboxId(), line);
        }
        return stamp(line);
    }

    /** Use the Instant the firing started at for duration. */
    public String firingFinished(Schedule schedule, boolean success, int successful, int total,
                                 int exchanges, Instant startedAt) {
        long ms = startedAt == null ? 0 : Duration.between(startedAt, clock.instant()).toMillis();
        String line = String.format("Finished %s | Contexts: %d/%d succeeded | Exchanges: %d | TookMs: %d",
                success ? "successfully" : "with failure", successful, total, exchanges, ms);
        if (success) {
            log.info("FIRING END | schedule={} {}", schedule.getId(), line);
        } else {
            log.warn("FIRING END | schedule={} {}", schedule.getId(), line);
        }
        return stamp(line);
    }

    public String firingFailed(Schedule schedule, String reason, Throwable t) {
        log.error("FIRING FAIL | schedule={} reason={}", schedule.getId(), reason, t);
        return stamp("Execution failed: " + reason);
    }

    private String stamp(String line) {
        return "[" + clock.instant() + "] " + line;
    }
}
