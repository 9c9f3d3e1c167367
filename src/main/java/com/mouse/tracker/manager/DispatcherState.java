package com.mouse.tracker.manager;

import com.mouse.tracker.enums.FiringPhase;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-schedule firing phase. A schedule is either absent (idle), claimed, or firing;
 * only one claim per schedule id can exist at a time.
 */
@Component
public class DispatcherState {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, FiringPhase> phases = new HashMap<>();
    private final Map<String, Instant> claimedAt = new HashMap<>();

    /** @return false if the schedule is already claimed or firing */
    public boolean tryClaim(String scheduleId, Instant now) {
        lock.lock();
        try {
            if (phases.containsKey(scheduleId)) {
                return false;
            }
            phases.put(scheduleId, FiringPhase.CLAIMED);
            claimedAt.put(scheduleId, now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void markFiring(String scheduleId) {
        lock.lock();
        try {
            phases.computeIfPresent(scheduleId, (id, phase) -> FiringPhase.FIRING);
        } finally {
            lock.unlock();
        }
    }

    public void release(String scheduleId) {
        lock.lock();
        try {
            phases.remove(scheduleId);
            claimedAt.remove(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    public FiringPhase phaseOf(String scheduleId) {
        lock.lock();
        try {
            return phases.getOrDefault(scheduleId, FiringPhase.IDLE);
        } finally {
            lock.unlock();
        }
    }

    public Instant claimedAt(String scheduleId) {
        lock.lock();
        try {
            return claimedAt.get(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> claimedIds() {
        lock.lock();
        try {
            return new LinkedHashSet<>(phases.keySet());
        } finally {
            lock.unlock();
        }
    }
}
