package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.component.Component;
import com.phodal.exporterhelper.consumer.OtlpTraceConsumer;

/**
 * Exporter component for OTLP trace batches.
 */
public interface OtlpTraceExporter extends Component, OtlpTraceConsumer {

    /**
     * Full name of the exporter as configured
     */
    String getName();
}
