package com.mouse.tracker.entity;

import com.mouse.tracker.converter.StringMapConverter;
import com.mouse.tracker.enums.HookLayer;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request/response pair observed inside a sandbox. Rows are append-only apart from
 * payload enrichment when the other hook layer saw a readable body.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "captured_exchange",
        indexes = {
                @Index(name = "idx_exchange_schedule_captured", columnList = "scheduleId, capturedAt"),
                @Index(name = "idx_exchange_sandbox", columnList = "sandboxId")
        })
public class CapturedExchange {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String scheduleId;

    @Column(length = 64)
    private String sandboxId;

    /** Correlation id assigned by the hook that saw the request. */
    @Column(length = 128)
    private String exchangeKey;

    @Column(nullable = false, length = 4096)
    private String url;

    @Column(length = 16)
    private String method;

    @Builder.Default
    @Convert(converter = StringMapConverter.class)
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private Map<String, String> requestHeaders = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private String requestBody;

    private Integer responseStatus;

    private String responseStatusText;

    @Builder.Default
    @Convert(converter = StringMapConverter.class)
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private Map<String, String> responseHeaders = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private String responseBody;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    private String extractedPayload;

    @Column(length = 1000)
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private HookLayer source;

    private Instant requestedAt;

    @Column(nullable = false)
    private Instant capturedAt;

    /** Store-assigned insertion order; breaks ties between equal capture times. */
    private long insertionSequence;

    private boolean complete;

    @Version
    private Integer version;

    public boolean hasPayload() {
        return extractedPayload != null;
    }
}
