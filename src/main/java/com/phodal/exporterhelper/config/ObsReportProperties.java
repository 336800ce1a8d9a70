package com.phodal.exporterhelper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for exporter observability.
 * Maps to exporterhelper.obsreport.* in application.yml
 */
@Data
@ConfigurationProperties(prefix = "exporterhelper.obsreport")
public class ObsReportProperties {

    /**
     * Whether export operations are recorded as spans (default: true).
     * When disabled, a no-op tracer is used.
     */
    private boolean enabled = true;

    /**
     * Whether sent/failed span counters are recorded (default: true).
     */
    private boolean metricsEnabled = true;

    /**
     * Instrumentation scope name of the export operation spans.
     */
    private String instrumentationName = "com.phodal.exporterhelper";
}
