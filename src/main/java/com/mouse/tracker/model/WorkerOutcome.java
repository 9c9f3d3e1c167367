package com.mouse.tracker.model;

import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.enums.WorkerStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What one sandbox contributed to a firing.
 */
@Value
@Builder
public class WorkerOutcome {
    String sandboxId;
    int index;
    WorkerStatus status;
    boolean success;
    @Builder.Default
    List<CapturedExchange> exchanges = List.of();
    String error;
    Instant startedAt;
    Instant finishedAt;
    int discardedExchanges;
    @Builder.Default
    List<String> logs = List.of();

    public static WorkerOutcome failed(int index, String error) {
        return WorkerOutcome.builder()
                .index(index)
                .status(WorkerStatus.ERROR)
                .success(false)
                .error(error)
                .logs(List.of("Context " + (index + 1) + " failed: " + error))
                .build();
    }

    /**
     * COMPLETED always counts. A timed out or removed context counts when it captured something.
     */
    public static boolean isSuccessful(WorkerStatus status, int exchangeCount) {
        if (status == WorkerStatus.COMPLETED) {
            return true;
        }
        return status == WorkerStatus.TIMED_OUT && exchangeCount > 0;
    }

    public long getPayloadCount() {
        return exchanges.stream().filter(CapturedExchange::hasPayload).count();
    }
}
