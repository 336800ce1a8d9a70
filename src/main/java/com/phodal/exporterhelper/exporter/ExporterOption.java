package com.phodal.exporterhelper.exporter;

/**
 * Customizes an exporter at construction time. Options are applied in the
 * order given; a later option overwrites what an earlier one set.
 */
@FunctionalInterface
public interface ExporterOption {

    void apply(ExporterOptions options);

    /**
     * Use {@code shutdown} as the exporter's shutdown procedure.
     */
    static ExporterOption withShutdown(Shutdown shutdown) {
        return options -> options.setShutdown(shutdown);
    }
}
