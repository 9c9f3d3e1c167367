package com.mouse.tracker.model;

import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.WorkerStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/** Read-only snapshot of a live context for status reporting. */
@Value
@Builder
public class WorkerContextView {
    String sandboxId;
    String scheduleId;
    String targetId;
    String url;
    int index;
    WorkerStatus status;
    Instant startedAt;
    Instant lastHeartbeat;
    int exchangeCount;
    Set<HookLayer> readyLayers;
    boolean stalled;

    public static WorkerContextView of(WorkerContext ctx, Instant now, long stallAfterMs) {
        return WorkerContextView.builder()
                .sandboxId(ctx.getSandboxId())
                .scheduleId(ctx.getScheduleId())
                .targetId(ctx.getTargetId())
                .url(ctx.getUrl())
                .index(ctx.getIndex())
                .status(ctx.getStatus())
                .startedAt(ctx.getStartedAt())
                .lastHeartbeat(ctx.getLastHeartbeat())
                .exchangeCount(ctx.getExchangeCount())
                .readyLayers(ctx.readyLayerSnapshot())
                .stalled(ctx.isStalled(now, stallAfterMs))
                .build();
    }
}
