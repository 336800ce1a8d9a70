package com.phodal.exporterhelper.consumer.data;

import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.SpanData;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trace batch in the OTLP layout: resource, then instrumentation scope, then spans.
 */
public final class OtlpTraceData implements SpanBatch {

    private static final OtlpTraceData EMPTY = new OtlpTraceData(List.of());

    private final List<ResourceSpans> resourceSpans;

    public OtlpTraceData(List<ResourceSpans> resourceSpans) {
        this.resourceSpans = List.copyOf(resourceSpans);
    }

    public static OtlpTraceData empty() {
        return EMPTY;
    }

    /**
     * Group SDK span data by resource and instrumentation scope, keeping the
     * order in which each resource and scope is first seen.
     */
    public static OtlpTraceData fromSpanData(Collection<SpanData> spans) {
        if (spans.isEmpty()) {
            return EMPTY;
        }
        Map<Resource, Map<InstrumentationScopeInfo, List<SpanData>>> grouped = new LinkedHashMap<>();
        for (SpanData span : spans) {
            grouped.computeIfAbsent(span.getResource(), r -> new LinkedHashMap<>())
                    .computeIfAbsent(span.getInstrumentationScopeInfo(), s -> new ArrayList<>())
                    .add(span);
        }

        List<ResourceSpans> result = new ArrayList<>(grouped.size());
        grouped.forEach((resource, byScope) -> {
            List<ScopeSpans> scopes = new ArrayList<>(byScope.size());
            byScope.forEach((scope, scopeSpans) -> scopes.add(new ScopeSpans(scope, scopeSpans)));
            result.add(new ResourceSpans(resource, scopes));
        });
        return new OtlpTraceData(result);
    }

    public List<ResourceSpans> getResourceSpans() {
        return resourceSpans;
    }

    @Override
    public int spanCount() {
        int count = 0;
        for (ResourceSpans rs : resourceSpans) {
            count += rs.spanCount();
        }
        return count;
    }

    @Override
    public String toString() {
        return "OtlpTraceData{resources=" + resourceSpans.size() + ", spans=" + spanCount() + "}";
    }
}
