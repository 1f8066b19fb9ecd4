package work.lcod.scoring.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scoring.deploy.DeploymentLoader;
import work.lcod.scoring.report.FailureStage;
import work.lcod.scoring.session.SessionState;
import work.lcod.scoring.session.graal.GraalJsEmbeddingService;
import work.lcod.scoring.support.RecordingDiagnosticSink;
import work.lcod.scoring.support.ScoringTestSupport;

class ModelScorerGraalTest {
    private final RecordingDiagnosticSink sink = new RecordingDiagnosticSink();

    @Test
    void stubArtifactScoresThePartialRow() {
        try (var scorer = new ModelScorer(
            ScoringTestSupport.hmeqDeployment("models/stub-model.js"),
            new GraalJsEmbeddingService(),
            sink
        )) {
            ScoreResult result = scorer.score(ScoringTestSupport.partialRow());
            assertEquals(0, result.status());
            assertEquals(Map.of("EM_CLASSIFICATION", "bad", "EM_EVENTPROBABILITY", 0.73), result.outputs());
            assertTrue(sink.at(LogLevel.ERROR).isEmpty());
        }
    }

    @Test
    void marshalsNormalizedFeaturesInOrder() {
        try (var scorer = new ModelScorer(
            ScoringTestSupport.hmeqDeployment("models/echo-model.js"),
            new GraalJsEmbeddingService(),
            sink
        )) {
            ScoreResult result = scorer.score(ScoringTestSupport.partialRow());
            assertEquals(
                "LOAN=18724.518046|MORTDUE=50000|VALUE=100000|REASON=Other|JOB=|YOJ=5|DEROG=0|DELINQ=0"
                    + "|CLAGE=100|NINQ=1|CLNO=10|DEBTINC=30",
                result.classification()
            );
        }
    }

    @Test
    void oversizedTextIsReportedAndLeftUnbound() {
        var row = new HashMap<>(ScoringTestSupport.completeRow());
        row.put("JOB", "Consultant");
        try (var scorer = new ModelScorer(
            ScoringTestSupport.hmeqDeployment("models/echo-model.js"),
            new GraalJsEmbeddingService(),
            sink
        )) {
            ScoreResult result = scorer.score(row);
            assertEquals(0, result.status());
            assertTrue(result.classification().contains("JOB=undefined"));
            assertEquals(1, sink.at(LogLevel.WARN).size());
            assertEquals(GraalJsEmbeddingService.TEXT_TOO_LONG, sink.at(LogLevel.WARN).get(0).status());
        }
    }

    @Test
    void logisticArtifactProducesProbabilities() {
        var deployment = DeploymentLoader.load(ScoringTestSupport.resource("deployments/hmeq.toml"));
        try (var scorer = new ModelScorer(deployment, new GraalJsEmbeddingService(), sink)) {
            List<Map<String, Object>> rows = List.of(
                ScoringTestSupport.partialRow(),
                ScoringTestSupport.completeRow(),
                Map.of(),
                Map.of("DEROG", 6d, "DELINQ", 9d, "DEBTINC", 80d, "JOB", "Sales")
            );
            for (Map<String, Object> row : rows) {
                ScoreResult result = scorer.score(row);
                assertEquals(0, result.status(), () -> "row " + row + " diagnostics " + sink.entries());
                assertTrue(result.eventProbability() >= 0 && result.eventProbability() <= 1);
                assertTrue(List.of("bad", "good").contains(result.classification()));
            }
            assertEquals("bad", scorer.score(rows.get(3)).classification());
        }
    }

    @Test
    void brokenArtifactFailsInitializationEveryTime() {
        var deployment = DeploymentLoader.load(ScoringTestSupport.resource("deployments/broken.toml"));
        try (var scorer = new ModelScorer(deployment, new GraalJsEmbeddingService(), sink)) {
            for (int i = 0; i < 2; i++) {
                ScoreResult result = scorer.score(Map.of("LOAN", 1000d));
                assertEquals(-1, result.status());
                assertEquals(FailureStage.INITIALIZE, result.failedStage());
                assertEquals(SessionState.FAILED, scorer.sessionState());
            }
            assertEquals(2, sink.at(LogLevel.ERROR).size());
        }
    }

    @Test
    void throwingArtifactFailsOnlyTheOffendingCall() {
        try (var scorer = new ModelScorer(
            ScoringTestSupport.hmeqDeployment("models/throwing-model.js"),
            new GraalJsEmbeddingService(),
            sink
        )) {
            var row = new HashMap<>(ScoringTestSupport.completeRow());
            row.put("DEBTINC", 250d);
            ScoreResult failed = scorer.score(row);
            assertEquals(GraalJsEmbeddingService.ROUTINE_ERROR, failed.status());
            assertEquals(FailureStage.EXECUTE, failed.failedStage());

            ScoreResult ok = scorer.score(ScoringTestSupport.completeRow());
            assertEquals(0, ok.status());
            assertEquals("good", ok.classification());
        }
    }
}
