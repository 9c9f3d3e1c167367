package com.mouse.tracker.interfaces;

import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.entity.ExecutionRecord;
import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.entity.Target;
import com.mouse.tracker.model.ExecutionStats;
import com.mouse.tracker.model.ExecutionUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seen by the scheduler and the interception bridge. The CRUD side of targets
 * and schedules belongs to whoever else writes this store.
 */
public interface TrackingStore {

    List<Schedule> listEnabledSchedules();

    Optional<Schedule> getSchedule(String scheduleId);

    /**
     * @throws com.mouse.tracker.exception.TargetNotFoundException if no target has this id
     */
    Target getTarget(String targetId);

    /** @return the id of the stored record */
    String createExecutionRecord(ExecutionRecord record);

    void updateExecutionRecord(String recordId, ExecutionUpdate update);

    List<ExecutionRecord> listUnfinishedExecutionRecords();

    ExecutionStats executionStats();

    /**
     * Appends an exchange, evicting the schedule's oldest exchanges beyond the capture cap.
     */
    CapturedExchange appendCapturedExchange(String scheduleId, CapturedExchange exchange);

    CapturedExchange updateCapturedExchange(CapturedExchange exchange);

    /** Newest first. */
    List<CapturedExchange> listCapturedExchanges(String scheduleId);

    /** Sets nextRun and stamps lastRun with the current time. */
    void updateScheduleNextRun(String scheduleId, Instant nextRun);

    void disableSchedule(String scheduleId);
}
