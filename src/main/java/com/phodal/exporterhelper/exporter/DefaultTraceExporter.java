package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.ExportException;
import com.phodal.exporterhelper.consumer.data.TraceData;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import io.opentelemetry.context.Context;

final class DefaultTraceExporter extends BaseTraceExporter<TraceData> implements TraceExporter {

    DefaultTraceExporter(String exporterFullName, BatchPusher<TraceData> dataPusher, Shutdown shutdown,
                         ExportReporter reporter) {
        super(exporterFullName, dataPusher, shutdown, reporter);
    }

    @Override
    public void consumeTraceData(Context context, TraceData traceData) throws ExportException {
        consume(context, traceData);
    }
}
