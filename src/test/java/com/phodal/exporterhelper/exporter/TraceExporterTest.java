package com.phodal.exporterhelper.exporter;

import com.phodal.exporterhelper.component.ComponentException;
import com.phodal.exporterhelper.config.ExporterSettings;
import com.phodal.exporterhelper.consumer.ExportException;
import com.phodal.exporterhelper.consumer.data.TraceData;
import io.opentelemetry.context.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for exporters built from legacy {@link TraceData} push functions.
 */
class TraceExporterTest {

    private static final String EXPORTER_NAME = "legacy-exporter";

    private RecordingExportReporter reporter;
    private ExporterHelper exporterHelper;
    private ExporterSettings config;

    @BeforeEach
    void setUp() {
        reporter = new RecordingExportReporter();
        exporterHelper = new ExporterHelper(reporter);
        config = ExporterSettings.named(EXPORTER_NAME);
    }

    @Test
    void shouldRejectNullConfig() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> exporterHelper.newTraceExporter(null, (ctx, td) -> PushResult.success()));
        assertEquals("nil config", e.getMessage());
    }

    @Test
    void shouldRejectNullConfigEvenWithoutPusher() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> exporterHelper.newTraceExporter(null, null));
        assertEquals("nil config", e.getMessage());
    }

    @Test
    void shouldRejectNullPusher() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> exporterHelper.newTraceExporter(config, null));
        assertEquals("nil pushTraceData", e.getMessage());
    }

    @Test
    void shouldAcceptEmptyName() {
        TraceExporter exporter = exporterHelper.newTraceExporter(
                ExporterSettings.named(""), (ctx, td) -> PushResult.success());
        assertEquals("", exporter.getName());
    }

    @Test
    void shouldTakeNameFromConfig() {
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success());
        assertEquals(EXPORTER_NAME, exporter.getName());
    }

    @Test
    void shouldFallBackToTypeWhenNameIsMissing() {
        ExporterSettings settings = ExporterSettings.builder().type("logging").build();
        TraceExporter exporter = exporterHelper.newTraceExporter(settings, (ctx, td) -> PushResult.success());
        assertEquals("logging", exporter.getName());
    }

    @Test
    void shouldStartWithoutSideEffects() {
        AtomicInteger pushes = new AtomicInteger();
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> {
            pushes.incrementAndGet();
            return PushResult.success();
        });

        assertDoesNotThrow(() -> exporter.start(error -> fail("no fatal error expected")));
        assertEquals(0, pushes.get());
        assertTrue(reporter.startedOperations.isEmpty());
    }

    @Test
    void shouldReturnPushErrorAndReportDroppedSpans() {
        ExportException unreachable = new ExportException("network unreachable");
        TraceExporter exporter = exporterHelper.newTraceExporter(config,
                (ctx, td) -> PushResult.failed(3, unreachable));

        ExportException thrown = assertThrows(ExportException.class,
                () -> exporter.consumeTraceData(Context.root(), SpanBatches.traceData(10)));

        assertSame(unreachable, thrown);
        RecordingExportReporter.Ended ended = reporter.onlyEnded();
        assertEquals(10, ended.numSpans());
        assertEquals(3, ended.numDroppedSpans());
        assertSame(unreachable, ended.error());
    }

    @Test
    void shouldSucceedOnPartialSuccess() {
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.dropped(2));

        assertDoesNotThrow(() -> exporter.consumeTraceData(Context.root(), SpanBatches.traceData(4)));

        RecordingExportReporter.Ended ended = reporter.onlyEnded();
        assertEquals(4, ended.numSpans());
        assertEquals(2, ended.numDroppedSpans());
        assertNull(ended.error());
    }

    @Test
    void shouldTagContextAndRunPusherInsideOperation() throws Exception {
        AtomicReference<Context> seen = new AtomicReference<>();
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> {
            seen.set(ctx);
            return PushResult.success();
        });

        exporter.consumeTraceData(Context.root(), SpanBatches.traceData(1));

        assertEquals(List.of(EXPORTER_NAME), reporter.taggedExporters);
        assertEquals(List.of(EXPORTER_NAME), reporter.startedOperations);
        assertEquals(EXPORTER_NAME, seen.get().get(RecordingExportReporter.EXPORTER_KEY));
        assertEquals("exporter/legacy-exporter/traces", seen.get().get(RecordingExportReporter.OPERATION_KEY));
    }

    @Test
    void shouldPassBatchThroughUnchanged() throws Exception {
        TraceData batch = SpanBatches.traceData(3);
        AtomicReference<TraceData> seen = new AtomicReference<>();
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> {
            seen.set(td);
            return PushResult.success();
        });

        exporter.consumeTraceData(Context.root(), batch);

        assertSame(batch, seen.get());
    }

    @Test
    void shouldReportEveryConsumeSeparately() throws Exception {
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success());

        exporter.consumeTraceData(Context.root(), SpanBatches.traceData(1));
        exporter.consumeTraceData(Context.root(), SpanBatches.traceData(2));
        exporter.consumeTraceData(Context.root(), SpanBatches.traceData(0));

        List<Integer> counts = new ArrayList<>();
        reporter.endedOperations.forEach(e -> counts.add(e.numSpans()));
        assertEquals(List.of(1, 2, 0), counts);
    }

    @Test
    void shouldReportRuntimeFailureAsFullyDroppedAndRethrow() {
        IllegalStateException boom = new IllegalStateException("boom");
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> {
            throw boom;
        });

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> exporter.consumeTraceData(Context.root(), SpanBatches.traceData(5)));

        assertSame(boom, thrown);
        RecordingExportReporter.Ended ended = reporter.onlyEnded();
        assertEquals(5, ended.numSpans());
        assertEquals(5, ended.numDroppedSpans());
        assertSame(boom, ended.error());
    }

    @Test
    void shouldShutdownAsNoopByDefault() {
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success());
        assertDoesNotThrow(exporter::shutdown);
    }

    @Test
    void shouldPropagateShutdownError() {
        ComponentException failure = new ComponentException("close failed");
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success(),
                ExporterOption.withShutdown(() -> {
                    throw failure;
                }));

        ComponentException thrown = assertThrows(ComponentException.class, exporter::shutdown);
        assertSame(failure, thrown);
    }

    @Test
    void shouldUseLastShutdownOption() throws Exception {
        List<String> calls = new ArrayList<>();
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success(),
                ExporterOption.withShutdown(() -> calls.add("first")),
                ExporterOption.withShutdown(() -> calls.add("second")));

        exporter.shutdown();

        assertEquals(List.of("second"), calls);
    }

    @Test
    void shouldKeepDefaultShutdownWhenOptionIsNull() {
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success(),
                (ExporterOption) null, ExporterOption.withShutdown(null));
        assertDoesNotThrow(exporter::shutdown);
    }

    @Test
    void shouldNotGuardConsumeAfterShutdown() throws Exception {
        TraceExporter exporter = exporterHelper.newTraceExporter(config, (ctx, td) -> PushResult.success());
        exporter.shutdown();

        assertDoesNotThrow(() -> exporter.consumeTraceData(Context.root(), SpanBatches.traceData(1)));
        assertEquals(1, reporter.endedOperations.size());
    }
}
