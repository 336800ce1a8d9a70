package com.phodal.exporterhelper.consumer;

import com.phodal.exporterhelper.consumer.data.OtlpTraceData;
import io.opentelemetry.context.Context;

/**
 * Consumes OTLP-shaped {@link OtlpTraceData} batches.
 */
public interface OtlpTraceConsumer {

    void consumeOtlpTrace(Context context, OtlpTraceData traceData) throws ExportException;
}
