package com.phodal.exporterhelper.exporter.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phodal.exporterhelper.config.ExporterConfig;
import com.phodal.exporterhelper.consumer.data.OtlpTraceData;
import com.phodal.exporterhelper.consumer.data.ResourceSpans;
import com.phodal.exporterhelper.consumer.data.ScopeSpans;
import com.phodal.exporterhelper.consumer.data.Span;
import com.phodal.exporterhelper.consumer.data.TraceData;
import com.phodal.exporterhelper.exporter.ExporterHelper;
import com.phodal.exporterhelper.exporter.ExporterOption;
import com.phodal.exporterhelper.exporter.OtlpTraceExporter;
import com.phodal.exporterhelper.exporter.PushResult;
import com.phodal.exporterhelper.exporter.TraceExporter;
import com.phodal.exporterhelper.obsreport.ObsReport;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.data.SpanData;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates exporters that write every span they receive to the application log.
 * Nothing is ever dropped; useful as a debugging sink.
 */
@Slf4j
public class LoggingExporterFactory {

    public static final String TYPE = "logging";

    private final ExporterHelper exporterHelper;
    private final ObjectMapper objectMapper;

    public LoggingExporterFactory(ExporterHelper exporterHelper, ObjectMapper objectMapper) {
        this.exporterHelper = exporterHelper;
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used when the application does not provide one. Writes
     * {@code java.time} values as ISO-8601 strings.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * @throws IllegalArgumentException if the exporter is disabled in {@code config}
     */
    public TraceExporter createTraceExporter(ExporterConfig config) {
        requireEnabled(config);
        return exporterHelper.newTraceExporter(config, this::pushTraceData,
                ExporterOption.withShutdown(() -> log.info("Logging exporter {} stopped", config.getName())));
    }

    /**
     * @throws IllegalArgumentException if the exporter is disabled in {@code config}
     */
    public OtlpTraceExporter createOtlpTraceExporter(ExporterConfig config) {
        requireEnabled(config);
        return exporterHelper.newOtlpTraceExporter(config, this::pushOtlpTraceData,
                ExporterOption.withShutdown(() -> log.info("Logging exporter {} stopped", config.getName())));
    }

    PushResult pushTraceData(Context context, TraceData traceData) {
        log.info("=== {}: {} spans from {} ===", ObsReport.exporterName(context),
                traceData.spanCount(), traceData.getServiceName());

        for (Span span : traceData.getSpans()) {
            log.info("  Span: {} | {} | {}ms | Status: {}",
                    span.getName(),
                    span.getKind(),
                    span.getDurationMs(),
                    span.getStatus() != null ? span.getStatus().getCode() : "UNSET"
            );
            if (!span.getAttributes().isEmpty()) {
                logAttributes(span.getAttributes());
            }
        }
        return PushResult.success();
    }

    PushResult pushOtlpTraceData(Context context, OtlpTraceData traceData) {
        log.info("=== {}: {} spans ===", ObsReport.exporterName(context), traceData.spanCount());

        for (ResourceSpans resourceSpans : traceData.getResourceSpans()) {
            log.info("Resource: {}", resourceSpans.resource().getAttributes());
            for (ScopeSpans scopeSpans : resourceSpans.scopeSpans()) {
                log.info(" Scope: {}", scopeSpans.scope().getName());
                for (SpanData span : scopeSpans.spans()) {
                    log.info("  Span: {} | {} | {}ms | Status: {}",
                            span.getName(),
                            span.getKind(),
                            (span.getEndEpochNanos() - span.getStartEpochNanos()) / 1_000_000,
                            span.getStatus().getStatusCode()
                    );
                    if (!span.getAttributes().isEmpty()) {
                        Map<String, Object> attributes = new LinkedHashMap<>();
                        span.getAttributes().forEach((key, value) ->
                                attributes.put(key.getKey(), value));
                        logAttributes(attributes);
                    }
                }
            }
        }
        return PushResult.success();
    }

    private static void requireEnabled(ExporterConfig config) {
        if (config != null && config.isDisabled()) {
            throw new IllegalArgumentException("exporter " + config.getName() + " is disabled");
        }
    }

    String writeAttributes(Map<String, Object> attributes) throws JsonProcessingException {
        return objectMapper.writeValueAsString(attributes);
    }

    private void logAttributes(Map<String, Object> attributes) {
        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            log.debug("    Attributes: {}", writeAttributes(attributes));
        } catch (JsonProcessingException e) {
            log.warn("    Attributes not serializable: {}", e.getMessage());
        }
    }
}
