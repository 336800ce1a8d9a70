package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.consumer.data.OtlpTraceData;

/**
 * Push function for {@link OtlpTraceData} batches.
 */
@FunctionalInterface
public interface OtlpTraceDataPusher extends BatchPusher<OtlpTraceData> {
}
