package com.phodal.exporterhelper.consumer.data;

import io.opentelemetry.sdk.resources.Resource;

import java.util.List;

/**
 * Spans emitted by one resource, grouped by instrumentation scope.
 *
 * @param resource the producing resource
 * @param scopeSpans spans per instrumentation scope
 */
public record ResourceSpans(Resource resource, List<ScopeSpans> scopeSpans) {

    public ResourceSpans {
        scopeSpans = List.copyOf(scopeSpans);
    }

    public int spanCount() {
        int count = 0;
        for (ScopeSpans scope : scopeSpans) {
            count += scope.spans().size();
        }
        return count;
    }
}
