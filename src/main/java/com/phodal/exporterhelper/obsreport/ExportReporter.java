package com.phodal.exporterhelper.obsreport;

import io.opentelemetry.context.Context;

/**
 * Records the observability signals of exporter operations.
 */
public interface ExportReporter {

    /**
     * Derive a context tagged with the exporter name. Measurements recorded
     * against the returned context are attributed to that exporter.
     */
    Context exporterContext(Context parent, String exporterName);

    /**
     * Start a trace export operation. The returned handle carries the context
     * the export must run in and must be passed to
     * {@link #endTraceDataExportOp(ExportOperation, int, int, Throwable)}.
     */
    ExportOperation startTraceDataExportOp(Context operationContext, String exporterName);

    /**
     * Finish an export operation.
     *
     * @param operation handle returned by {@link #startTraceDataExportOp(Context, String)}
     * @param numSpans spans in the exported batch
     * @param numDroppedSpans spans that could not be delivered
     * @param error outcome of the export, {@code null} on success
     */
    void endTraceDataExportOp(ExportOperation operation, int numSpans, int numDroppedSpans, Throwable error);
}
