package com.phodal.exporterhelper.component;

/**
 * The pipeline host that drives component lifecycles.
 */
public interface Host {

    /**
     * Report an unrecoverable error raised by a component after it has started.
     * The host decides whether the pipeline keeps running.
     */
    void reportFatalError(Throwable error);
}
