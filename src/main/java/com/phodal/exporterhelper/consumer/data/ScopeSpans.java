package com.phodal.exporterhelper.consumer.data;

import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.trace.data.SpanData;

import java.util.List;

/**
 * Spans recorded by a single instrumentation scope.
 *
 * @param scope the instrumentation scope
 * @param spans finished spans
 */
public record ScopeSpans(InstrumentationScopeInfo scope, List<SpanData> spans) {

    public ScopeSpans {
        spans = List.copyOf(spans);
    }
}
