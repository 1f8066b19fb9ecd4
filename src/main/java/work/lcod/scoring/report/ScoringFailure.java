package work.lcod.scoring.report;

import java.util.Objects;

/**
 * Fatal failure of one scoring call, carrying the status code returned to the caller.
 */
public final class ScoringFailure extends Exception {
    private final int status;
    private final FailureStage stage;

    public ScoringFailure(int status, FailureStage stage, String message) {
        this(status, stage, message, null);
    }

    public ScoringFailure(int status, FailureStage stage, String message, Throwable cause) {
        super(message, cause);
        if (status == 0) {
            throw new IllegalArgumentException("Failure status must be non-zero");
        }
        this.status = status;
        this.stage = Objects.requireNonNull(stage, "stage");
    }

    public int status() {
        return status;
    }

    public FailureStage stage() {
        return stage;
    }
}
