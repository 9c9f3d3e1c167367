package com.mouse.tracker.entity;

import com.mouse.tracker.enums.ScheduleKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * When and how often a target is visited.
 * <p>
 * Only the parameter matching {@link #kind} is meaningful: {@code cronExpression} for CRON,
 * {@code intervalMinutes} for INTERVAL and {@code fireAt} for ONCE.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "schedule",
        indexes = {
                @Index(name = "idx_schedule_enabled_next_run", columnList = "enabled, nextRun"),
                @Index(name = "idx_schedule_target", columnList = "targetId")
        })
public class Schedule {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String targetId;

    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ScheduleKind kind;

    @Column(length = 128)
    private String cronExpression;

    private Integer intervalMinutes;

    private Instant fireAt;

    @Builder.Default
    @Column(nullable = false)
    private int quantity = 1;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant nextRun;

    private Instant lastRun;

    @Version
    private Integer version;

    public String describeTiming() {
        if (kind == null) {
            return "unknown";
        }
        return switch (kind) {
            case CRON -> "cron '" + cronExpression + "'";
            case INTERVAL -> "every " + intervalMinutes + " min";
            case ONCE -> "once at " + fireAt;
        };
    }
}
