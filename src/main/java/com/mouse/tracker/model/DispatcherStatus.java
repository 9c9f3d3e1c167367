package com.mouse.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class DispatcherStatus {
    boolean running;
    Instant lastTickAt;
    Set<String> claimedScheduleIds;
    List<WorkerContextView> activeContexts;
    long stalledContexts;
}
