package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.ExportException;

/**
 * Outcome of pushing one batch downstream.
 *
 * @param droppedSpans spans that were not delivered
 * @param error failure of the push, {@code null} when it succeeded; a non-zero
 *              {@code droppedSpans} with a {@code null} error is a partial success
 */
public record PushResult(int droppedSpans, ExportException error) {

    private static final PushResult SUCCESS = new PushResult(0, null);

    public static PushResult success() {
        return SUCCESS;
    }

    public static PushResult dropped(int droppedSpans) {
        return new PushResult(droppedSpans, null);
    }

    public static PushResult failed(int droppedSpans, ExportException error) {
        return new PushResult(droppedSpans, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
