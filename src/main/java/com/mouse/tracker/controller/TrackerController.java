package com.mouse.tracker.controller;

import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.exception.InvalidScheduleException;
import com.mouse.tracker.exception.ScheduleNotFoundException;
import com.mouse.tracker.exception.TargetNotFoundException;
import com.mouse.tracker.interfaces.TrackingStore;
import com.mouse.tracker.interfaces.WorkerLauncher;
import com.mouse.tracker.manager.ScheduleDispatcher;
import com.mouse.tracker.model.DispatcherStatus;
import com.mouse.tracker.model.ExchangeSummary;
import com.mouse.tracker.model.WorkerContextView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/tracker")
public class TrackerController {

    private final ScheduleDispatcher dispatcher;
    private final WorkerLauncher launcher;
    private final TrackingStore store;

    /**
     * Dispatcher state: running flag, claimed schedules and live contexts.
     */
    @GetMapping("/status")
    public ResponseEntity<DispatcherStatus> status() {
        return ResponseEntity.ok(dispatcher.status());
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        log.info("POST /api/v1/tracker/start");
        dispatcher.start();
        return ResponseEntity.ok(body("running", dispatcher.isRunning()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        log.info("POST /api/v1/tracker/stop");
        dispatcher.stop();
        return ResponseEntity.ok(body("running", dispatcher.isRunning()));
    }

    /**
     * Fire a schedule immediately. Returns 409 when it is already firing.
     */
    @PostMapping("/schedules/{id}/execute")
    public ResponseEntity<Map<String, Object>> execute(@PathVariable("id") String scheduleId) {
        log.info("POST /api/v1/tracker/schedules/{}/execute", scheduleId);
        Optional<CompletableFuture<String>> firing = dispatcher.forceExecute(scheduleId);
        if (firing.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(body("message", "Schedule is already executing"));
        }
        Map<String, Object> response = body("scheduleId", scheduleId);
        response.put("started", true);
        return ResponseEntity.accepted().body(response);
    }

    @GetMapping("/schedules/{id}/due")
    public ResponseEntity<Map<String, Object>> isDue(@PathVariable("id") String scheduleId) {
        Map<String, Object> response = body("scheduleId", scheduleId);
        response.put("due", dispatcher.checkScheduleNow(scheduleId));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/schedules/upcoming")
    public ResponseEntity<List<Schedule>> upcoming(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(dispatcher.upcoming(limit));
    }

    @GetMapping("/contexts")
    public ResponseEntity<List<WorkerContextView>> contexts() {
        return ResponseEntity.ok(launcher.activeContexts());
    }

    @DeleteMapping("/schedules/{id}/contexts")
    public ResponseEntity<Map<String, Object>> closeScheduleContexts(@PathVariable("id") String scheduleId) {
        log.info("DELETE /api/v1/tracker/schedules/{}/contexts", scheduleId);
        return ResponseEntity.ok(body("closed", launcher.closeScheduleContexts(scheduleId)));
    }

    @DeleteMapping("/contexts")
    public ResponseEntity<Map<String, Object>> closeAllContexts() {
        log.info("DELETE /api/v1/tracker/contexts");
        return ResponseEntity.ok(body("closed", launcher.closeAll()));
    }

    @GetMapping("/schedules/{id}/exchanges")
    public ResponseEntity<List<ExchangeSummary>> exchanges(@PathVariable("id") String scheduleId) {
        List<CapturedExchange> exchanges = store.listCapturedExchanges(scheduleId);
        return ResponseEntity.ok(exchanges.stream().map(ExchangeSummary::of).toList());
    }

    @GetMapping("/schedules/{id}/exchanges/full")
    public ResponseEntity<List<CapturedExchange>> fullExchanges(@PathVariable("id") String scheduleId) {
        return ResponseEntity.ok(store.listCapturedExchanges(scheduleId));
    }

    @GetMapping("/executions/stats")
    public ResponseEntity<Map<String, Object>> executionStats() {
        var stats = store.executionStats();
        Map<String, Object> response = body("total", stats.getTotal());
        response.put("successful", stats.getSuccessful());
        response.put("failed", stats.getFailed());
        response.put("running", stats.getRunning());
        response.put("successRate", stats.getSuccessRate());
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler({ScheduleNotFoundException.class, TargetNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("error", e.getMessage()));
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<Map<String, Object>> invalidSchedule(InvalidScheduleException e) {
        return ResponseEntity.badRequest().body(body("error", e.getMessage()));
    }

    private static Map<String, Object> body(String key, Object value) {
        Map<String, Object> response = new HashMap<>();
        response.put(key, value);
        response.put("timestamp", Instant.now());
        return response;
    }
}
