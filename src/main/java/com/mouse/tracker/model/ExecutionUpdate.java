package com.mouse.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of an execution record. Null fields are left untouched.
 */
@Value
@Builder
public class ExecutionUpdate {
    Instant endTime;
    Boolean success;
    String errorMessage;
    List<String> logs;
    String executionData;
}
