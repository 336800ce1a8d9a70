package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.component.ComponentException;

/**
 * Releases the resources held by an exporter.
 */
@FunctionalInterface
public interface Shutdown {

    Shutdown NOOP = () -> { };

    void shutdown() throws ComponentException;
}
