package com.phodal.exporterhelper.exporter;

/**
 * Mutable settings collected from {@link ExporterOption}s before an exporter is built.
 */
public final class ExporterOptions {

    private Shutdown shutdown;

    ExporterOptions() {
    }

    static ExporterOptions of(ExporterOption... options) {
        ExporterOptions opts = new ExporterOptions();
        if (options != null) {
            for (ExporterOption option : options) {
                if (option != null) {
                    option.apply(opts);
                }
            }
        }
        return opts;
    }

    public Shutdown getShutdown() {
        return shutdown;
    }

    public void setShutdown(Shutdown shutdown) {
        this.shutdown = shutdown;
    }
}
