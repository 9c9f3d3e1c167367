package com.mouse.tracker.manager;

import com.mouse.tracker.model.WorkerContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live worker contexts keyed by sandbox id.
 */
@Component
public class WorkerRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, WorkerContext> contexts = new LinkedHashMap<>();

    public void register(WorkerContext ctx) {
        lock.lock();
        try {
            contexts.put(ctx.getSandboxId(), ctx);
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkerContext> remove(String sandboxId) {
        lock.lock();
        try {
            return Optional.ofNullable(contexts.remove(sandboxId));
        } finally {
            lock.unlock();
        }
    }

    public List<WorkerContext> bySchedule(String scheduleId) {
        lock.lock();
        try {
            List<WorkerContext> result = new ArrayList<>();
            for (WorkerContext ctx : contexts.values()) {
                if (ctx.getScheduleId() != null && ctx.getScheduleId().equals(scheduleId)) {
                    result.add(ctx);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<WorkerContext> all() {
        lock.lock();
        try {
            return new ArrayList<>(contexts.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return contexts.size();
        } finally {
            lock.unlock();
        }
    }
}
