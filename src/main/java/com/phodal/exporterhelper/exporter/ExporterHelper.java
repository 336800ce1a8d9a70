package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.config.ExporterConfig;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds exporter components out of plain push functions.
 *
 * Every exporter built here records an export operation through the
 * {@link ExportReporter} for each batch it consumes. If no options are passed
 * the exporter only adds its name as a tag in the context and does nothing on
 * shutdown.
 */
@Slf4j
@RequiredArgsConstructor
public class ExporterHelper {

    static final String ERR_NIL_CONFIG = "nil config";
    static final String ERR_NIL_PUSH_TRACE_DATA = "nil pushTraceData";

    private final ExportReporter reporter;

    /**
     * Create a {@link TraceExporter} for legacy trace batches.
     *
     * @throws IllegalArgumentException if {@code config} or {@code dataPusher} is null
     */
    public TraceExporter newTraceExporter(ExporterConfig config, TraceDataPusher dataPusher,
                                          ExporterOption... options) {
        validate(config, dataPusher);
        ExporterOptions opts = ExporterOptions.of(options);

        String name = config.getName();
        TraceExporter exporter = new DefaultTraceExporter(
                name, dataPusher.withObservability(reporter, name), shutdownOrDefault(opts), reporter);
        log.debug("Created trace exporter {}", name);
        return exporter;
    }

    /**
     * Create an {@link OtlpTraceExporter} for OTLP trace batches.
     *
     * @throws IllegalArgumentException if {@code config} or {@code dataPusher} is null
     */
    public OtlpTraceExporter newOtlpTraceExporter(ExporterConfig config, OtlpTraceDataPusher dataPusher,
                                                  ExporterOption... options) {
        validate(config, dataPusher);
        ExporterOptions opts = ExporterOptions.of(options);

        String name = config.getName();
        OtlpTraceExporter exporter = new DefaultOtlpTraceExporter(
                name, dataPusher.withObservability(reporter, name), shutdownOrDefault(opts), reporter);
        log.debug("Created OTLP trace exporter {}", name);
        return exporter;
    }

    private static void validate(ExporterConfig config, BatchPusher<?> dataPusher) {
        if (config == null) {
            throw new IllegalArgumentException(ERR_NIL_CONFIG);
        }
        if (dataPusher == null) {
            throw new IllegalArgumentException(ERR_NIL_PUSH_TRACE_DATA);
        }
    }

    private static Shutdown shutdownOrDefault(ExporterOptions opts) {
        return opts.getShutdown() != null ? opts.getShutdown() : Shutdown.NOOP;
    }
}
