package work.lcod.scoring.session.graal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.scoring.api.OutputNames;
import work.lcod.scoring.model.ImputationTable;
import work.lcod.scoring.session.ScoringProgram;
import work.lcod.scoring.session.SessionHandle;

class GraalJsEmbeddingServiceTest {
    private static final ImputationTable TABLE = ImputationTable.builder()
        .numeric("LOAN", 18724.518046)
        .text("REASON", 7)
        .numeric("DEBTINC", 33.6879)
        .build();

    private final GraalJsEmbeddingService service = new GraalJsEmbeddingService();
    private SessionHandle session;

    @AfterEach
    void closeSession() {
        if (session != null) {
            session.close();
        }
    }

    @Test
    void publishesAndRunsTheRoutine() {
        session = published("function predict(f) { return { label: f.REASON === 'HomeImp' ? 'bad' : 'good', probability: f.DEBTINC / 100 }; }");

        assertEquals(0, service.selectRoutine(session, "score_hmeq"));
        assertEquals(0, service.bindNumeric(session, "LOAN", 1500));
        assertEquals(0, service.bindText(session, "REASON", "HomeImp"));
        assertEquals(0, service.bindNumeric(session, "DEBTINC", 42));
        assertEquals(0, service.execute(session));

        assertEquals("bad", service.readText(session, "EM_CLASSIFICATION"));
        assertEquals(0.42, service.readNumeric(session, "EM_EVENTPROBABILITY"), 1e-12);
    }

    @Test
    void acceptsArrayResults() {
        session = published("function predict(f) { return ['bad', 0.73]; }");
        service.selectRoutine(session, "score_hmeq");
        assertEquals(0, service.execute(session));
        assertEquals("bad", service.readText(session, "EM_CLASSIFICATION"));
        assertEquals(0.73, service.readNumeric(session, "EM_EVENTPROBABILITY"), 0.0);
    }

    @Test
    void revisionsIncreaseWithEachPublish() {
        var program = program("function predict(f) { return ['bad', 0.73]; }");
        session = service.createSession();
        assertEquals(1, service.publish(session, program.text(), "hmeq_a"));
        assertEquals(2, service.publish(session, program.text(), "hmeq_a"));
    }

    @Test
    void usesAppendedLinesWhenNoTextIsGiven() {
        var program = program("function predict(f) { return ['good', 0.1]; }");
        session = service.createSession();
        program.lines().forEach(line -> service.appendSourceLine(session, line));
        assertEquals(1, service.publish(session, null, "hmeq_a"));
        assertEquals(0, service.selectRoutine(session, "score_hmeq"));
    }

    @Test
    void syntaxErrorsAndMissingPredictYieldRevisionZero() {
        session = service.createSession();
        assertEquals(0, service.publish(session, program("function predict(f) { return [; }").text(), "hmeq_a"));
        assertEquals(0, service.publish(session, program("function classify(f) { return []; }").text(), "hmeq_a"));
        assertEquals(0, service.publish(session, "var x = 1;", "hmeq_a"));
    }

    @Test
    void reportsSelectionAndBindingStatuses() {
        session = published("function predict(f) { return ['bad', 0.73]; }");
        assertEquals(GraalJsEmbeddingService.NO_ROUTINE, service.bindNumeric(session, "LOAN", 1));
        assertEquals(GraalJsEmbeddingService.NO_ROUTINE, service.selectRoutine(session, "score_other"));
        assertEquals(GraalJsEmbeddingService.NO_ROUTINE, service.execute(session));

        assertEquals(0, service.selectRoutine(session, "score_hmeq"));
        assertEquals(GraalJsEmbeddingService.UNDECLARED_PARAMETER, service.bindNumeric(session, "INCOME", 1));
        assertEquals(GraalJsEmbeddingService.UNDECLARED_PARAMETER, service.bindText(session, "LOAN", "1500"));
        assertEquals(GraalJsEmbeddingService.UNDECLARED_PARAMETER, service.bindNumeric(session, "REASON", 1));
        assertEquals(GraalJsEmbeddingService.TEXT_TOO_LONG, service.bindText(session, "REASON", "DebtConsolidation"));
    }

    @Test
    void unboundParametersReachTheModelAsUndefined() {
        session = published(
            "function predict(f) { return { label: String(f.REASON), probability: f.LOAN === undefined ? 1 : 0 }; }"
        );
        service.selectRoutine(session, "score_hmeq");
        service.bindText(session, "REASON", "DebtConsolidation");
        assertEquals(0, service.execute(session));
        assertEquals("undefined", service.readText(session, "EM_CLASSIFICATION"));
        assertEquals(1.0, service.readNumeric(session, "EM_EVENTPROBABILITY"), 0.0);
    }

    @Test
    void routineErrorsAndMissingOutputsAreStatuses() {
        session = published("function predict(f) { if (f.DEBTINC > 100) { throw new Error('out of range'); } return { label: 'good' }; }");
        service.selectRoutine(session, "score_hmeq");
        service.bindNumeric(session, "DEBTINC", 250);
        assertEquals(GraalJsEmbeddingService.ROUTINE_ERROR, service.execute(session));
        assertThrows(IllegalStateException.class, () -> service.readText(session, "EM_CLASSIFICATION"));

        service.selectRoutine(session, "score_hmeq");
        service.bindNumeric(session, "DEBTINC", 20);
        assertEquals(GraalJsEmbeddingService.MISSING_OUTPUT, service.execute(session));
    }

    @Test
    void closedSessionsRejectWork() {
        session = published("function predict(f) { return ['bad', 0.73]; }");
        session.close();
        assertFalse(session.isOpen());
        assertEquals(GraalJsEmbeddingService.SESSION_CLOSED, service.selectRoutine(session, "score_hmeq"));
        assertEquals(GraalJsEmbeddingService.SESSION_CLOSED, service.execute(session));
        assertEquals(0, service.publish(session, "var x;", "hmeq_a"));
    }

    @Test
    void rejectsForeignHandles() {
        SessionHandle foreign = new SessionHandle() {
            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public void close() {
            }
        };
        assertThrows(IllegalArgumentException.class, () -> service.execute(foreign));
        assertTrue(foreign.isOpen());
    }

    @Test
    void malformedParameterSignaturesCannotBeSelected() {
        session = service.createSession();
        assertEquals(1, service.publish(session, """
            var __lcodRoutines = {
              badKind: { parameters: { LOAN: { kind: 5 } }, run: function (a) { return {}; } },
              badLength: { parameters: { JOB: { kind: 'text', length: 'long' } }, run: function (a) { return {}; } },
              good: { parameters: { LOAN: { kind: 'numeric' } }, run: function (a) { return {}; } }
            };
            """, "hmeq_a"));

        assertEquals(GraalJsEmbeddingService.NO_ROUTINE, service.selectRoutine(session, "badKind"));
        assertEquals(GraalJsEmbeddingService.NO_ROUTINE, service.selectRoutine(session, "badLength"));
        assertEquals(GraalJsEmbeddingService.OK, service.selectRoutine(session, "good"));
    }

    private SessionHandle published(String artifact) {
        SessionHandle handle = service.createSession();
        assertEquals(1, service.publish(handle, program(artifact).text(), "hmeq_a"));
        return handle;
    }

    private static ScoringProgram program(String artifact) {
        return ScoringProgram.render(artifact, "hmeq_a", "score_hmeq", TABLE, OutputNames.DEFAULT);
    }
}
