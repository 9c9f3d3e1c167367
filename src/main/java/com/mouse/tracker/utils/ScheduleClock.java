package com.mouse.tracker.utils;

import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.entity.Schedule;
import com.mouse.tracker.exception.InvalidScheduleException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes when schedules fire. Stateless; callers always pass {@code now}.
 */
@Component
public class ScheduleClock {

    private final ZoneId zone;

    @Autowired
    public ScheduleClock(TrackerConfig config) {
        this(ZoneId.of(config.getScheduleZone()));
    }

    public ScheduleClock(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * @throws InvalidScheduleException when the kind is missing or its parameter is missing/invalid
     */
    public Instant computeNextRun(Schedule schedule, Instant now) {
        validate(schedule);
        return switch (schedule.getKind()) {
            case CRON -> CronSupport.next(schedule.getCronExpression(), now, zone);
            case INTERVAL -> now.plus(Duration.ofMinutes(schedule.getIntervalMinutes()));
            case ONCE -> schedule.getFireAt();
        };
    }

    public boolean isDue(Schedule schedule, Instant now) {
        return schedule.isEnabled()
                && schedule.getNextRun() != null
                && !schedule.getNextRun().isAfter(now);
    }

    public void validate(Schedule schedule) {
        if (schedule == null || schedule.getKind() == null) {
            throw new InvalidScheduleException("Schedule kind is missing");
        }
        if (schedule.getQuantity() < 1) {
            throw new InvalidScheduleException("Quantity must be at least 1, got " + schedule.getQuantity());
        }
        switch (schedule.getKind()) {
            case CRON -> CronSupport.parse(schedule.getCronExpression());
            case INTERVAL -> {
                Integer minutes = schedule.getIntervalMinutes();
                if (minutes == null || minutes < 1) {
                    throw new InvalidScheduleException("Interval must be at least 1 minute, got " + minutes);
                }
            }
            case ONCE -> {
                if (schedule.getFireAt() == null) {
                    throw new InvalidScheduleException("One-time schedule has no fire time");
                }
            }
        }
    }

    public boolean isValid(Schedule schedule) {
        try {
            validate(schedule);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * Enabled schedules whose next run lies in the future, soonest first.
     */
    public List<Schedule> upcoming(Collection<Schedule> schedules, Instant now, int limit) {
        return schedules.stream()
                .filter(Schedule::isEnabled)
                .filter(s -> s.getNextRun() != null && s.getNextRun().isAfter(now))
                .sorted(Comparator.comparing(Schedule::getNextRun))
                .limit(Math.max(0, limit))
                .toList();
    }

    public List<Instant> nextRuns(String cronExpression, Instant from, int count) {
        return CronSupport.nextRuns(cronExpression, from, zone, count);
    }

    public ZoneId getZone() {
        return zone;
    }
}
