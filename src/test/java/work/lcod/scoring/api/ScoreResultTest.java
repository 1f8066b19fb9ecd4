package work.lcod.scoring.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scoring.report.FailureStage;

class ScoreResultTest {
    @Test
    void successCarriesExactlyTheTwoOutputs() {
        var result = ScoreResult.success("good", 0.08, OutputNames.DEFAULT);
        assertTrue(result.isSuccess());
        assertEquals(List.of("EM_CLASSIFICATION", "EM_EVENTPROBABILITY"), List.copyOf(result.outputs().keySet()));
        assertEquals(
            Map.of("EM_CLASSIFICATION", "good", "EM_EVENTPROBABILITY", 0.08, "status", 0),
            result.toSerializableMap()
        );
    }

    @Test
    void failureCarriesNoOutputs() {
        var result = ScoreResult.failure(-1, FailureStage.INITIALIZE, OutputNames.DEFAULT);
        assertEquals(Map.of(), result.outputs());
        assertEquals(Map.of("status", -1, "stage", "initialize"), result.toSerializableMap());
        assertThrows(IllegalArgumentException.class, () -> ScoreResult.failure(0, FailureStage.EXECUTE, OutputNames.DEFAULT));
    }

    @Test
    void outputNamesMustDiffer() {
        assertThrows(IllegalArgumentException.class, () -> new OutputNames("P", "P"));
        assertThrows(IllegalArgumentException.class, () -> new OutputNames(" ", "P"));
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.ERROR, LogLevel.from(" error "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertTrue(LogLevel.FATAL.isAtLeast(LogLevel.ERROR));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}
