package com.mouse.tracker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExecutionStats {
    long total;
    long successful;
    long failed;
    long running;

    /** Percentage of finished records that succeeded, 0 when nothing finished yet. */
    public double getSuccessRate() {
        long finished = successful + failed;
        return finished == 0 ? 0.0 : Math.round(successful * 1000.0 / finished) / 10.0;
    }
}
