package com.mouse.tracker.service;

import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.entity.ExecutionRecord;
import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.entity.Target;
import com.mouse.tracker.exception.TargetNotFoundException;
import com.mouse.tracker.interfaces.TrackingStore;
import com.mouse.tracker.model.ExecutionStats;
import com.mouse.tracker.model.ExecutionUpdate;
import com.mouse.tracker.repository.CapturedExchangeRepository;
import com.mouse.tracker.repository.ExecutionRecordRepository;
import com.mouse.tracker.repository.ScheduleRepository;
import com.mouse.tracker.repository.TargetRepository;
import com.mouse.tracker.utils.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTrackingStore implements TrackingStore {

    private final TargetRepository targetRepository;
    private final ScheduleRepository scheduleRepository;
    private final ExecutionRecordRepository executionRecordRepository;
    private final CapturedExchangeRepository capturedExchangeRepository;
    private final TrackerConfig config;
    private final Clock clock;

    // -1 until seeded from the highest persisted value
    private final AtomicLong insertionSequence = new AtomicLong(-1);

    @Override
    @Transactional(readOnly = true)
    public List<Schedule> listEnabledSchedules() {
        return scheduleRepository.findByEnabledTrue();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Schedule> getSchedule(String scheduleId) {
        return scheduleRepository.findById(scheduleId);
    }

    @Override
    @Transactional(readOnly = true)
    public Target getTarget(String targetId) {
        if (targetId == null) {
            throw new TargetNotFoundException("Target id is missing");
        }
        return targetRepository.findById(targetId)
                .orElseThrow(() -> new TargetNotFoundException("Target not found: " + targetId));
    }

    @Override
    @Transactional
    public String createExecutionRecord(ExecutionRecord record) {
        if (record.getId() == null) {
            record.setId(IdGenerator.newId());
        }
        if (record.getStartTime() == null) {
            record.setStartTime(clock.instant());
        }
        ExecutionRecord saved = executionRecordRepository.save(record);
        log.debug("Execution record created | Id: {} | Schedule: {}", saved.getId(), saved.getScheduleId());
        return saved.getId();
    }

    @Override
    @Transactional
    public void updateExecutionRecord(String recordId, ExecutionUpdate update) {
        ExecutionRecord record = executionRecordRepository.findById(recordId).orElse(null);
        if (record == null) {
            log.warn("Execution record vanished before update | Id: {}", recordId);
            return;
        }

        if (update.getEndTime() != null) {
            record.setEndTime(update.getEndTime());
        }
        if (update.getSuccess() != null) {
            record.setSuccess(update.getSuccess());
        }
        if (update.getErrorMessage() != null) {
            record.setErrorMessage(truncate(update.getErrorMessage(), 4000));
        }
        if (update.getLogs() != null) {
            record.setLogs(new ArrayList<>(update.getLogs()));
        }
        if (update.getExecutionData() != null) {
            record.setExecutionData(update.getExecutionData());
        }
        executionRecordRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExecutionRecord> listUnfinishedExecutionRecords() {
        return executionRecordRepository.findByEndTimeIsNull();
    }

    @Override
    @Transactional(readOnly = true)
    public ExecutionStats executionStats() {
        long successful = executionRecordRepository.countSuccessful();
        long failed = executionRecordRepository.countFailed();
        long total = executionRecordRepository.count();
        return ExecutionStats.builder()
                .total(total)
                .successful(successful)
                .failed(failed)
                .running(Math.max(0, total - successful - failed))
                .build();
    }

    @Override
    @Transactional
    public CapturedExchange appendCapturedExchange(String scheduleId, CapturedExchange exchange) {
        exchange.setScheduleId(scheduleId);
        if (exchange.getId() == null) {
            exchange.setId(IdGenerator.newId());
        }
        if (exchange.getCapturedAt() == null) {
            exchange.setCapturedAt(clock.instant());
        }
        exchange.setInsertionSequence(nextInsertionSequence());
        CapturedExchange saved = capturedExchangeRepository.saveAndFlush(exchange);
        evictBeyondCap(scheduleId);
        return saved;
    }

    @Override
    @Transactional
    public CapturedExchange updateCapturedExchange(CapturedExchange exchange) {
        return capturedExchangeRepository.save(exchange);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CapturedExchange> listCapturedExchanges(String scheduleId) {
        return capturedExchangeRepository.findByScheduleIdOrderByCapturedAtDesc(scheduleId);
    }

    @Override
    @Transactional
    public void updateScheduleNextRun(String scheduleId, Instant nextRun) {
        scheduleRepository.findById(scheduleId).ifPresentOrElse(schedule -> {
            schedule.setNextRun(nextRun);
            schedule.setLastRun(clock.instant());
            scheduleRepository.save(schedule);
        }, () -> log.warn("Cannot update next run, schedule not found | Id: {}", scheduleId));
    }

    @Override
    @Transactional
    public void disableSchedule(String scheduleId) {
        scheduleRepository.findById(scheduleId).ifPresentOrElse(schedule -> {
            schedule.setEnabled(false);
            schedule.setLastRun(clock.instant());
            scheduleRepository.save(schedule);
        }, () -> log.warn("Cannot disable, schedule not found | Id: {}", scheduleId));
    }

    private void evictBeyondCap(String scheduleId) {
        int cap = config.getCaptureCap();
        if (cap <= 0) {
            return;
        }
        long count = capturedExchangeRepository.countByScheduleId(scheduleId);
        int excess = (int) (count - cap);
        if (excess <= 0) {
            return;
        }
        List<CapturedExchange> oldest = capturedExchangeRepository
                .findByScheduleIdOrderByCapturedAtAscInsertionSequenceAsc(scheduleId, PageRequest.of(0, excess));
        capturedExchangeRepository.deleteAll(oldest);
        log.debug("Evicted captured exchanges | Schedule: {} | Evicted: {} | Cap: {}", scheduleId, oldest.size(), cap);
    }

    private long nextInsertionSequence() {
        if (insertionSequence.get() < 0) {
            synchronized (insertionSequence) {
                if (insertionSequence.get() < 0) {
                    Long max = capturedExchangeRepository.findMaxInsertionSequence();
                    insertionSequence.set(max == null ? 0 : max);
                }
            }
        }
        return insertionSequence.incrementAndGet();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
