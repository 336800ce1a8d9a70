package com.phodal.exporterhelper.config;

/**
 * Configuration of a single exporter instance.
 */
public interface ExporterConfig {

    /**
     * Exporter type, e.g. {@code logging} or {@code otlp}.
     */
    String getType();

    /**
     * Full name of the exporter instance. Unique within a pipeline.
     */
    String getName();

    /**
     * Disabled exporters are not created by exporter factories.
     */
    default boolean isDisabled() {
        return false;
    }
}
