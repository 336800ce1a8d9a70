package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.ExportException;
import com.phodal.exporterhelper.consumer.data.OtlpTraceData;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import io.opentelemetry.context.Context;

final class DefaultOtlpTraceExporter extends BaseTraceExporter<OtlpTraceData> implements OtlpTraceExporter {

    DefaultOtlpTraceExporter(String exporterFullName, BatchPusher<OtlpTraceData> dataPusher, Shutdown shutdown,
                             ExportReporter reporter) {
        super(exporterFullName, dataPusher, shutdown, reporter);
    }

    @Override
    public void consumeOtlpTrace(Context context, OtlpTraceData traceData) throws ExportException {
        consume(context, traceData);
    }
}
