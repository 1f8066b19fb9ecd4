package work.lcod.scoring.invoke;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import work.lcod.scoring.api.OutputNames;
import work.lcod.scoring.api.ScoreResult;
import work.lcod.scoring.model.FeatureKind;
import work.lcod.scoring.model.FeatureRecord;
import work.lcod.scoring.model.ImputationEntry;
import work.lcod.scoring.model.ImputationTable;
import work.lcod.scoring.report.FailureStage;
import work.lcod.scoring.report.ScoreReporter;
import work.lcod.scoring.report.ScoringFailure;
import work.lcod.scoring.session.EmbeddingService;
import work.lcod.scoring.session.SessionHandle;
import work.lcod.scoring.session.ScoringSession;

/**
 * Binds a normalized record into the session, runs the scoring routine and reads its two outputs.
 *
 * <p>A failed parameter bind is reported and the remaining parameters are still bound; the routine then runs
 * without that parameter. Routine selection and execution failures end the call.
 */
public final class ModelInvoker {
    private final EmbeddingService service;
    private final String routineName;
    private final ImputationTable table;
    private final OutputNames outputNames;
    private final ScoreReporter reporter;

    public ModelInvoker(
        EmbeddingService service,
        String routineName,
        ImputationTable table,
        OutputNames outputNames,
        ScoreReporter reporter
    ) {
        this.service = Objects.requireNonNull(service, "service");
        this.routineName = Objects.requireNonNull(routineName, "routineName");
        this.table = Objects.requireNonNull(table, "table");
        this.outputNames = Objects.requireNonNull(outputNames, "outputNames");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public ScoreResult invoke(ScoringSession session, FeatureRecord record) throws ScoringFailure {
        Lock lock = service.supportsConcurrentExecute() ? null : session.invocationLock();
        if (lock != null) {
            lock.lock();
        }
        try {
            return invokeLocked(session.handle(), record);
        } finally {
            if (lock != null) {
                lock.unlock();
            }
        }
    }

    private ScoreResult invokeLocked(SessionHandle handle, FeatureRecord record) throws ScoringFailure {
        int status = service.selectRoutine(handle, routineName);
        if (status != 0) {
            throw new ScoringFailure(status, FailureStage.SELECT, "Unable to select routine " + routineName);
        }

        for (ImputationEntry entry : table.entries()) {
            int bindStatus = entry.kind() == FeatureKind.NUMERIC
                ? service.bindNumeric(handle, entry.name(), record.numeric(entry.name()))
                : service.bindText(handle, entry.name(), record.text(entry.name()));
            if (bindStatus != 0) {
                reporter.bindFailed(entry.name(), bindStatus);
            }
        }

        status = service.execute(handle);
        if (status != 0) {
            throw new ScoringFailure(status, FailureStage.EXECUTE, "Routine " + routineName + " failed");
        }

        String classification = service.readText(handle, outputNames.classification());
        double probability = service.readNumeric(handle, outputNames.probability());
        return reporter.success(classification, probability);
    }
}
