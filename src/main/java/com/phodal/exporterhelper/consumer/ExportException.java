package com.phodal.exporterhelper.consumer;

/**
 * Failure to deliver a batch of spans downstream.
 * Exporters surface the instance produced by their push function unchanged.
 */
public class ExportException extends Exception {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
