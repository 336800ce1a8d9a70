package com.phodal.exporterhelper.component;

/**
 * Raised when a component fails to start or shut down.
 */
public class ComponentException extends Exception {

    public ComponentException(String message) {
        super(message);
    }

    public ComponentException(String message, Throwable cause) {
        super(message, cause);
    }
}
