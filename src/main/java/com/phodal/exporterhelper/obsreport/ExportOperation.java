package com.phodal.exporterhelper.obsreport;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;

/**
 * Handle of one in-flight export operation.
 *
 * @param exporterName exporter the operation is attributed to
 * @param context context the export runs in, with {@code span} as current span
 * @param span span covering the operation
 */
public record ExportOperation(String exporterName, Context context, Span span) {
}
