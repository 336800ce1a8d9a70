package com.phodal.exporterhelper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.exporterhelper.exporter.ExporterHelper;
import com.phodal.exporterhelper.exporter.logging.LoggingExporterFactory;
import com.phodal.exporterhelper.obsreport.ExportReporter;
import com.phodal.exporterhelper.obsreport.ObsReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exporter helper auto-configuration.
 * Creates the ExportReporter and ExporterHelper beans, reusing the
 * application's OpenTelemetry and MeterRegistry when it has them.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ObsReportProperties.class)
public class ObsReportConfig {

    @Bean
    @ConditionalOnMissingBean
    public ExportReporter exportReporter(ObsReportProperties properties,
                                         ObjectProvider<OpenTelemetry> openTelemetry,
                                         ObjectProvider<MeterRegistry> meterRegistry) {
        OpenTelemetry otel = properties.isEnabled()
                ? openTelemetry.getIfAvailable(OpenTelemetry::noop)
                : OpenTelemetry.noop();
        if (!properties.isEnabled()) {
            log.info("Export operation tracing is disabled. Using no-op tracer.");
        }

        Tracer tracer = otel.getTracer(properties.getInstrumentationName());
        MeterRegistry registry = meterRegistry.getIfAvailable(() -> Metrics.globalRegistry);

        log.info("Initializing exporter obsreport: tracing={}, metrics={}",
                properties.isEnabled(), properties.isMetricsEnabled());
        return new ObsReport(tracer, registry, properties.isMetricsEnabled());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExporterHelper exporterHelper(ExportReporter exportReporter) {
        return new ExporterHelper(exportReporter);
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingExporterFactory loggingExporterFactory(ExporterHelper exporterHelper,
                                                         ObjectProvider<ObjectMapper> objectMapper) {
        return new LoggingExporterFactory(exporterHelper,
                objectMapper.getIfAvailable(LoggingExporterFactory::defaultObjectMapper));
    }
}
