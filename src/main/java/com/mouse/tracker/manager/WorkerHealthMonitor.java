package com.mouse.tracker.manager;

import com.mouse.tracker.interfaces.WorkerLauncher;
import com.mouse.tracker.model.WorkerContextView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports contexts whose hooks stopped sending heartbeats. Reporting only: the hard
 * timeout still decides when such a context ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerHealthMonitor {

    private static final String EMOJI_HEALTH = "💚";
    private static final String EMOJI_WARNING = "⚠️";

    private final WorkerLauncher launcher;

    @Scheduled(fixedDelayString = "${tracker.worker.health-check-ms:15000}",
            initialDelayString = "${tracker.worker.health-check-ms:15000}")
    public void scheduledCheck() {
        try {
            checkHealth();
        } catch (Exception e) {
            log.error("Error in scheduled context health check: {}", e.getMessage());
        }
    }

    /** @return the stalled contexts found in this pass */
    public List<WorkerContextView> checkHealth() {
        List<WorkerContextView> active = launcher.activeContexts();
        List<WorkerContextView> stalled = active.stream().filter(WorkerContextView::isStalled).toList();

        for (WorkerContextView ctx : stalled) {
            log.warn("{} Context stalled | Sandbox: {} | Schedule: {} | Status: {} | LastHeartbeat: {}",
                    EMOJI_WARNING, ctx.getSandboxId(), ctx.getScheduleId(), ctx.getStatus(), ctx.getLastHeartbeat());
        }
        if (!active.isEmpty()) {
            log.debug("{} Context health | Active: {} | Stalled: {}", EMOJI_HEALTH, active.size(), stalled.size());
        }
        return stalled;
    }
}
