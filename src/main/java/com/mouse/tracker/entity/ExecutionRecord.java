package com.mouse.tracker.entity;

import com.mouse.tracker.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "execution_record",
        indexes = {
                @Index(name = "idx_execution_schedule", columnList = "scheduleId"),
                @Index(name = "idx_execution_start", columnList = "startTime"),
                @Index(name = "idx_execution_end", columnList = "endTime")
        })
public class ExecutionRecord {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String targetId;

    @Column(nullable = false, length = 64)
    private String scheduleId;

    @Column(nullable = false)
    private Instant startTime;

    /** Null while the firing is still running. */
    private Instant endTime;

    @Column(nullable = false)
    private boolean success;

    @Column(length = 4000)
    private String errorMessage;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private List<String> logs = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private String executionData;

    @Version
    private Integer version;

    public boolean isRunning() {
        return endTime == null;
    }

    public long getDurationMs() {
        if (startTime == null || endTime == null) {
            return 0;
        }
        return Duration.between(startTime, endTime).toMillis();
    }
}
