package com.phodal.exporterhelper.consumer.data;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TraceDataTest {

    @Test
    void shouldCountSpans() {
        TraceData data = TraceData.builder()
                .serviceName("svc")
                .span(Span.builder().name("one").build())
                .span(Span.builder().name("two").build())
                .build();

        assertEquals(2, data.spanCount());
        assertEquals(0, TraceData.builder().build().spanCount());
    }

    @Test
    void shouldComputeSpanDuration() {
        Span span = Span.builder()
                .name("db.query")
                .startTime(Instant.ofEpochMilli(1_000))
                .endTime(Instant.ofEpochMilli(1_250))
                .build();

        assertEquals(250, span.getDurationMs());
        assertTrue(span.isRoot());
        assertEquals(SpanKind.UNSPECIFIED, span.getKind());
        assertEquals(0, Span.builder().build().getDurationMs());
    }

    @Test
    void shouldTreatCodeZeroAsOk() {
        assertTrue(SpanStatus.ok().isOk());
        assertFalse(SpanStatus.error(SpanStatus.CODE_UNKNOWN, "failed").isOk());
    }
}
