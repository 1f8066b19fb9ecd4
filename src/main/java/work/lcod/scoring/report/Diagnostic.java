package work.lcod.scoring.report;

import java.time.Instant;
import java.util.Objects;
import work.lcod.scoring.api.LogLevel;

/**
 * Structured diagnostic emitted by the scoring pipeline.
 */
public record Diagnostic(LogLevel level, int status, FailureStage stage, String moduleId, String message, Instant at) {
    public Diagnostic {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(at, "at");
    }

    public static Diagnostic of(LogLevel level, int status, FailureStage stage, String moduleId, String message) {
        return new Diagnostic(level, status, stage, moduleId, message, Instant.now());
    }

    public String render() {
        return "[" + moduleId + "] " + stage.name().toLowerCase() + " status=" + status + ": " + message;
    }
}
