package com.mouse.tracker.interfaces;

import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.entity.Target;
import com.mouse.tracker.model.WorkerContextView;
import com.mouse.tracker.model.WorkerOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface WorkerLauncher {

    /**
     * Opens one sandbox for a firing. The future always completes, with a failed outcome
     * rather than exceptionally when the sandbox could not be created.
     */
    CompletableFuture<WorkerOutcome> launch(Target target, Schedule schedule, int index);

    /** @return number of contexts that were asked to close */
    int closeScheduleContexts(String scheduleId);

    int closeAll();

    List<WorkerContextView> activeContexts();
}
