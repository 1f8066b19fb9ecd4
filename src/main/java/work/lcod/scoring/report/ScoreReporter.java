package work.lcod.scoring.report;

import java.util.Objects;
import work.lcod.scoring.api.LogLevel;
import work.lcod.scoring.api.OutputNames;
import work.lcod.scoring.api.ScoreResult;

/**
 * Turns pipeline outcomes into {@link ScoreResult}s and emits one diagnostic per fatal failure.
 */
public final class ScoreReporter {
    private final String moduleId;
    private final OutputNames outputNames;
    private final DiagnosticSink sink;

    public ScoreReporter(String moduleId, OutputNames outputNames, DiagnosticSink sink) {
        this.moduleId = Objects.requireNonNull(moduleId, "moduleId");
        this.outputNames = Objects.requireNonNull(outputNames, "outputNames");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ScoreResult success(String classification, double eventProbability) {
        return ScoreResult.success(classification, eventProbability, outputNames);
    }

    public ScoreResult failure(ScoringFailure failure) {
        String message = failure.getMessage();
        if (failure.getCause() != null && failure.getCause().getMessage() != null) {
            message = message + ": " + failure.getCause().getMessage();
        }
        sink.emit(Diagnostic.of(LogLevel.ERROR, failure.status(), failure.stage(), moduleId, message));
        return ScoreResult.failure(failure.status(), failure.stage(), outputNames);
    }

    public ScoreResult unexpected(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        return failure(new ScoringFailure(ScoreResult.STATUS_INTERNAL_ERROR, FailureStage.INTERNAL, message));
    }

    /** Non-fatal: the call goes on with the remaining parameters. */
    public void bindFailed(String feature, int status) {
        sink.emit(Diagnostic.of(
            LogLevel.WARN,
            status,
            FailureStage.BIND,
            moduleId,
            "Unable to bind parameter " + feature
        ));
    }

    public void published(int revision) {
        sink.emit(Diagnostic.of(
            LogLevel.INFO,
            ScoreResult.STATUS_OK,
            FailureStage.INITIALIZE,
            moduleId,
            "Scoring program published at revision " + revision
        ));
    }
}
