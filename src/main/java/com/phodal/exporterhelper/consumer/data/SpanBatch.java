package com.phodal.exporterhelper.consumer.data;

/**
 * A batch of spans in any of the supported representations.
 */
public interface SpanBatch {

    /**
     * Number of span records contained in this batch.
     */
    int spanCount();
}
