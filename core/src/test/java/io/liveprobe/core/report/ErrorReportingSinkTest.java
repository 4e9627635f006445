package io.liveprobe.core.report;

import io.liveprobe.core.engine.OperationOutcome;
import io.liveprobe.core.engine.OutcomeType;
import io.liveprobe.core.routing.DocumentKey;
import io.liveprobe.core.storage.StorageException;
import io.liveprobe.core.workload.OperationKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReportingSinkTest {

    private record Report(String message, Throwable error, Map<String, String> context) {}

    private final List<Report> reports = new ArrayList<>();
    private final ErrorReportingSink sink = new ErrorReportingSink(
            (message, error, context) -> reports.add(new Report(message, error, context)));

    @Test
    void successesAreNotReported() {
        sink.record(new OperationOutcome("worker-0", OperationKind.FIND,
                new DocumentKey(1, "doc-1", null), OutcomeType.SUCCESS, 1000L, null));
        assertTrue(reports.isEmpty());
    }

    @Test
    void operationErrorCarriesKeyLocationAndTransientHint() {
        StorageException cause = new StorageException("timed out", true);
        sink.record(new OperationOutcome("worker-3", OperationKind.UPDATE,
                new DocumentKey(7, "00ab", "DE"), OutcomeType.OPERATION_ERROR, 1000L, cause));

        assertEquals(1, reports.size());
        Report r = reports.get(0);
        assertEquals("Operation failed: update", r.message());
        assertSame(cause, r.error());
        assertEquals(Map.of(
                "op", "update",
                "outcome", "OPERATION_ERROR",
                "worker", "worker-3",
                "id", "00ab",
                "location", "DE",
                "transient", "true"), r.context());
    }

    @Test
    void unexpectedErrorWithoutKeyStillReports() {
        sink.record(new OperationOutcome("worker-1", OperationKind.INSERT,
                null, OutcomeType.UNEXPECTED_ERROR, 0L, new IllegalStateException("bug")));

        Report r = reports.get(0);
        assertEquals("Unexpected error: insert", r.message());
        assertFalse(r.context().containsKey("id"));
        assertFalse(r.context().containsKey("transient"));
    }

    @Test
    void loggingReporterNeverThrows() {
        LoggingErrorReporter reporter = new LoggingErrorReporter();
        assertDoesNotThrow(() -> reporter.report("Operation failed: find", null, Map.of("op", "find")));
    }
}
