package com.phodal.exporterhelper.consumer.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single span record in the legacy trace representation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Span {

    private String traceId;
    private String spanId;
    private String parentSpanId;
    private String name;

    @Builder.Default
    private SpanKind kind = SpanKind.UNSPECIFIED;

    private Instant startTime;
    private Instant endTime;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    private SpanStatus status;

    /**
     * Duration in milliseconds, or 0 when either timestamp is missing.
     */
    public long getDurationMs() {
        if (startTime != null && endTime != null) {
            return endTime.toEpochMilli() - startTime.toEpochMilli();
        }
        return 0;
    }

    public boolean isRoot() {
        return parentSpanId == null || parentSpanId.isEmpty();
    }
}
