package com.phodal.exporterhelper.component;

/**
 * Lifecycle contract shared by every pipeline component.
 * The host calls {@link #start(Host)} once before any data flows and
 * {@link #shutdown()} once during teardown.
 */
public interface Component {

    /**
     * Start the component. Long-running work must not block this call.
     */
    void start(Host host) throws ComponentException;

    /**
     * Stop the component and release any resources it holds.
     */
    void shutdown() throws ComponentException;
}
