package com.phodal.exporterhelper.consumer;

import com.phodal.exporterhelper.consumer.data.TraceData;
import io.opentelemetry.context.Context;

/**
 * Consumes legacy {@link TraceData} batches.
 */
public interface TraceConsumer {

    void consumeTraceData(Context context, TraceData traceData) throws ExportException;
}
