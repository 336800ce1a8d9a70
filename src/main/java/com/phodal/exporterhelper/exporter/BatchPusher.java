package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.data.SpanBatch;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import io.opentelemetry.context.Context;

/**
 * Delivers a batch of spans downstream and reports how many were dropped.
 * Transport, serialization and retries all live behind this function.
 *
 * @param <B> batch representation
 */
@FunctionalInterface
public interface BatchPusher<B extends SpanBatch> {

    PushResult push(Context context, B batch);

    /**
     * Wrap this pusher so that every call is recorded as an export operation
     * of {@code exporterName}.
     */
    default BatchPusher<B> withObservability(ExportReporter reporter, String exporterName) {
        return new ObservabilityPusher<>(this, reporter, exporterName);
    }
}
