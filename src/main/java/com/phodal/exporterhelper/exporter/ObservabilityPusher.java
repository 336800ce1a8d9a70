package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.data.SpanBatch;
import com.phodal.exporterhelper.obsreport.ExportOperation;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import io.opentelemetry.context.Context;

/**
 * Records an export operation around each call of the wrapped pusher.
 * The delegate's result is returned untouched.
 */
final class ObservabilityPusher<B extends SpanBatch> implements BatchPusher<B> {

    private final BatchPusher<B> delegate;
    private final ExportReporter reporter;
    private final String exporterName;

    ObservabilityPusher(BatchPusher<B> delegate, ExportReporter reporter, String exporterName) {
        this.delegate = delegate;
        this.reporter = reporter;
        this.exporterName = exporterName;
    }

    @Override
    public PushResult push(Context context, B batch) {
        ExportOperation operation = reporter.startTraceDataExportOp(context, exporterName);
        PushResult result;
        try {
            result = delegate.push(operation.context(), batch);
        } catch (RuntimeException e) {
            // no result to report: the whole batch counts as dropped
            int numSpans = batch.spanCount();
            reporter.endTraceDataExportOp(operation, numSpans, numSpans, e);
            throw e;
        }

        reporter.endTraceDataExportOp(operation, batch.spanCount(), result.droppedSpans(), result.error());
        return result;
    }

    @Override
    public String toString() {
        return "ObservabilityPusher{exporter=" + exporterName + ", delegate=" + delegate + "}";
    }
}
