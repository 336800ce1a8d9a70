package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.component.Component;
import com.phodal.exporterhelper.consumer.TraceConsumer;

/**
 * Exporter component for legacy trace batches.
 */
public interface TraceExporter extends Component, TraceConsumer {

    /**
     * Full name of the exporter as configured
     */
    String getName();
}
