package work.lcod.scoring.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.scoring.report.FailureStage;

/**
 * Outcome of scoring one row: a label and an event probability with status {@code 0}, or a non-zero status and
 * no outputs.
 */
public record ScoreResult(
    int status,
    String classification,
    Double eventProbability,
    FailureStage failedStage,
    OutputNames outputNames
) {
    public static final int STATUS_OK = 0;
    public static final int STATUS_PUBLISH_FAILED = -1;
    public static final int STATUS_INTERNAL_ERROR = -2;

    public ScoreResult {
        Objects.requireNonNull(outputNames, "outputNames");
        if (status == STATUS_OK) {
            Objects.requireNonNull(classification, "classification");
            Objects.requireNonNull(eventProbability, "eventProbability");
            if (failedStage != null) {
                throw new IllegalArgumentException("A successful result has no failed stage");
            }
        } else {
            Objects.requireNonNull(failedStage, "failedStage");
            if (classification != null || eventProbability != null) {
                throw new IllegalArgumentException("A failed result carries no outputs");
            }
        }
    }

    public static ScoreResult success(String classification, double eventProbability, OutputNames outputNames) {
        return new ScoreResult(STATUS_OK, classification, eventProbability, null, outputNames);
    }

    public static ScoreResult failure(int status, FailureStage stage, OutputNames outputNames) {
        if (status == STATUS_OK) {
            throw new IllegalArgumentException("Failure status must be non-zero");
        }
        return new ScoreResult(status, null, null, stage, outputNames);
    }

    public boolean isSuccess() {
        return status == STATUS_OK;
    }

    /** Output record handed to the row sink; empty when scoring failed. */
    public Map<String, Object> outputs() {
        if (!isSuccess()) {
            return Map.of();
        }
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(outputNames.classification(), classification);
        outputs.put(outputNames.probability(), eventProbability);
        return Collections.unmodifiableMap(outputs);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>(outputs());
        serializable.put("status", status);
        if (failedStage != null) {
            serializable.put("stage", failedStage.name().toLowerCase());
        }
        return serializable;
    }
}
