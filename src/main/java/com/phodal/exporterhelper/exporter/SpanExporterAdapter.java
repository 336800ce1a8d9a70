package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.component.ComponentException;
import com.phodal.exporterhelper.consumer.ExportException;
import com.phodal.exporterhelper.consumer.data.OtlpTraceData;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

/**
 * Exposes an {@link OtlpTraceExporter} as an OpenTelemetry SDK {@link SpanExporter},
 * so exporters built by {@link ExporterHelper} can sit behind a span processor.
 */
@Slf4j
public final class SpanExporterAdapter implements SpanExporter {

    private final OtlpTraceExporter delegate;

    public SpanExporterAdapter(OtlpTraceExporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        try {
            delegate.consumeOtlpTrace(Context.current(), OtlpTraceData.fromSpanData(spans));
            return CompletableResultCode.ofSuccess();
        } catch (ExportException e) {
            log.warn("Export of {} spans by {} failed: {}", spans.size(), delegate.getName(), e.getMessage());
            return CompletableResultCode.ofFailure();
        }
    }

    @Override
    public CompletableResultCode flush() {
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode shutdown() {
        try {
            delegate.shutdown();
            return CompletableResultCode.ofSuccess();
        } catch (ComponentException e) {
            log.warn("Shutdown of {} failed: {}", delegate.getName(), e.getMessage(), e);
            return CompletableResultCode.ofFailure();
        }
    }

    @Override
    public String toString() {
        return "SpanExporterAdapter{delegate=" + delegate + "}";
    }
}
