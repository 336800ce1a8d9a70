package com.phodal.exporterhelper.consumer.data;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Legacy trace batch: the spans reported by a single node, with the
 * resource labels they share and the format they were received in.
 */
@Value
@Builder
public class TraceData implements SpanBatch {

    String serviceName;

    @Singular("resourceLabel")
    Map<String, String> resource;

    @Singular
    List<Span> spans;

    String sourceFormat;

    @Override
    public int spanCount() {
        return spans.size();
    }
}
