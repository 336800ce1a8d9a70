package com.phodal.exporterhelper.obsreport;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ExportReporter} backed by an OpenTelemetry {@link Tracer} for
 * operation spans and a Micrometer {@link MeterRegistry} for span counters.
 *
 * Each export operation produces a span named {@code exporter/<name>/traces}
 * and, when metrics are enabled, increments
 * {@value #SENT_SPANS_METRIC} and {@value #FAILED_SPANS_METRIC}.
 */
@Slf4j
public class ObsReport implements ExportReporter {

    public static final String SENT_SPANS_METRIC = "exporter.sent.spans";
    public static final String FAILED_SPANS_METRIC = "exporter.send.failed.spans";
    public static final String EXPORTER_TAG = "exporter";

    public static final AttributeKey<String> ATTR_EXPORTER = AttributeKey.stringKey("exporter");
    public static final AttributeKey<Long> ATTR_SENT_SPANS = AttributeKey.longKey("sent_spans");
    public static final AttributeKey<Long> ATTR_FAILED_SPANS = AttributeKey.longKey("send_failed_spans");

    private static final String EXPORTER_PREFIX = "exporter/";
    private static final String TRACES_OPERATION_SUFFIX = "/traces";

    private static final ContextKey<String> EXPORTER_KEY = ContextKey.named("exporterhelper.exporter");

    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final boolean metricsEnabled;

    public ObsReport(Tracer tracer, MeterRegistry meterRegistry, boolean metricsEnabled) {
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.metricsEnabled = metricsEnabled;
    }

    /**
     * Exporter name a context was tagged with, or {@code null} if untagged.
     */
    public static String exporterName(Context context) {
        return context.get(EXPORTER_KEY);
    }

    @Override
    public Context exporterContext(Context parent, String exporterName) {
        return parent.with(EXPORTER_KEY, exporterName);
    }

    @Override
    public ExportOperation startTraceDataExportOp(Context operationContext, String exporterName) {
        Span span = tracer.spanBuilder(EXPORTER_PREFIX + exporterName + TRACES_OPERATION_SUFFIX)
                .setParent(operationContext)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(ATTR_EXPORTER, exporterName)
                .startSpan();
        Context exportContext = operationContext.with(span);
        return new ExportOperation(exporterName, exportContext, span);
    }

    @Override
    public void endTraceDataExportOp(ExportOperation operation, int numSpans, int numDroppedSpans, Throwable error) {
        long sent = (long) numSpans - numDroppedSpans;

        if (metricsEnabled) {
            // counters only move forward, even if a pusher over-reports drops
            sentSpans(operation.exporterName()).increment(Math.max(0L, sent));
            failedSpans(operation.exporterName()).increment(Math.max(0, numDroppedSpans));
        }

        Span span = operation.span();
        span.setAttribute(ATTR_SENT_SPANS, sent);
        span.setAttribute(ATTR_FAILED_SPANS, (long) numDroppedSpans);
        if (error != null) {
            span.setStatus(StatusCode.ERROR, statusDescription(error));
            span.recordException(error);
        } else {
            span.setStatus(StatusCode.OK);
        }
        span.end();

        log.debug("Export by {} finished: sent={}, failed={}, error={}",
                operation.exporterName(), sent, numDroppedSpans, error != null);
    }

    private static String statusDescription(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private Counter sentSpans(String exporterName) {
        return Counter.builder(SENT_SPANS_METRIC)
                .description("Number of spans successfully sent to destination")
                .tag(EXPORTER_TAG, exporterName)
                .register(meterRegistry);
    }

    private Counter failedSpans(String exporterName) {
        return Counter.builder(FAILED_SPANS_METRIC)
                .description("Number of spans in failed attempts to send to destination")
                .tag(EXPORTER_TAG, exporterName)
                .register(meterRegistry);
    }
}
