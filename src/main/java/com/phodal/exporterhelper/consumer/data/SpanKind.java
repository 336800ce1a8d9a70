package com.phodal.exporterhelper.consumer.data;

/**
 * Span kind as carried by the legacy trace representation.
 */
public enum SpanKind {
    /**
     * Kind not reported by the producer
     */
    UNSPECIFIED,

    /**
     * Handles an incoming request
     */
    SERVER,

    /**
     * Issues an outgoing request
     */
    CLIENT
}
