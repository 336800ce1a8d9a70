package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.data.TraceData;

/**
 * Push function for legacy {@link TraceData} batches.
 */
@FunctionalInterface
public interface TraceDataPusher extends BatchPusher<TraceData> {
}
