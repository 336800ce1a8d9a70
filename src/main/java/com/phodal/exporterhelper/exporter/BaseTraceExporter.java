package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.component.ComponentException;
import com.phodal.exporterhelper.component.Host;
import com.phodal.exporterhelper.consumer.ExportException;
import com.phodal.exporterhelper.consumer.data.SpanBatch;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import io.opentelemetry.context.Context;

/**
 * State and lifecycle shared by the exporters built in {@link ExporterHelper}.
 * Name, pusher and shutdown procedure are fixed at construction.
 *
 * @param <B> batch representation
 */
abstract class BaseTraceExporter<B extends SpanBatch> {

    private final String exporterFullName;
    private final BatchPusher<B> dataPusher;
    private final Shutdown shutdown;
    private final ExportReporter reporter;

    BaseTraceExporter(String exporterFullName, BatchPusher<B> dataPusher, Shutdown shutdown,
                      ExportReporter reporter) {
        this.exporterFullName = exporterFullName;
        this.dataPusher = dataPusher;
        this.shutdown = shutdown;
        this.reporter = reporter;
    }

    public String getName() {
        return exporterFullName;
    }

    public void start(Host host) throws ComponentException {
        // nothing to acquire
    }

    /**
     * Push {@code batch} through the instrumented pusher. The dropped count is
     * recorded by the pusher and not returned.
     */
    void consume(Context context, B batch) throws ExportException {
        Context exporterContext = reporter.exporterContext(context, exporterFullName);
        PushResult result = dataPusher.push(exporterContext, batch);
        if (result.error() != null) {
            throw result.error();
        }
    }

    public void shutdown() throws ComponentException {
        shutdown.shutdown();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + exporterFullName + "}";
    }
}
