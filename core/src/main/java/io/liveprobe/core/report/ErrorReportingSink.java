package io.liveprobe.core.report;

import io.liveprobe.core.engine.OperationOutcome;
import io.liveprobe.core.engine.OutcomeSink;
import io.liveprobe.core.engine.OutcomeType;
import io.liveprobe.core.storage.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Forwards failed outcomes to an {@link ErrorReporter}, tagged with the
 * operation kind, key id, location and worker. Successes are ignored.
 */
public final class ErrorReportingSink implements OutcomeSink {

    private final ErrorReporter reporter;

    public ErrorReportingSink(ErrorReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    @Override
    public void record(OperationOutcome outcome) {
        if (outcome.success()) {
            return;
        }
        reporter.report(messageFor(outcome), outcome.error(), context(outcome));
    }

    static Map<String, String> context(OperationOutcome o) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("op", o.kind().wireName());
        ctx.put("outcome", o.type().name());
        ctx.put("worker", o.workerId());
        if (o.key() != null) {
            ctx.put("id", o.key().id());
            if (o.key().hasLocation()) {
                ctx.put("location", o.key().location());
            }
        }
        if (o.error() instanceof StorageException se) {
            ctx.put("transient", Boolean.toString(se.transientFailure()));
        }
        return ctx;
    }

    private static String messageFor(OperationOutcome o) {
        return o.type() == OutcomeType.OPERATION_ERROR
                ? "Operation failed: " + o.kind().wireName()
                : "Unexpected error: " + o.kind().wireName();
    }
}
