package work.lcod.scoring.api;

import java.util.Map;
import java.util.Objects;
import work.lcod.scoring.deploy.DeploymentDescriptor;
import work.lcod.scoring.invoke.ModelInvoker;
import work.lcod.scoring.model.FeatureRecord;
import work.lcod.scoring.normalize.FeatureNormalizer;
import work.lcod.scoring.report.DiagnosticSink;
import work.lcod.scoring.report.ScoreReporter;
import work.lcod.scoring.report.ScoringFailure;
import work.lcod.scoring.report.Slf4jDiagnosticSink;
import work.lcod.scoring.session.EmbeddingService;
import work.lcod.scoring.session.ScoringProgram;
import work.lcod.scoring.session.ScoringSession;
import work.lcod.scoring.session.SessionManager;
import work.lcod.scoring.session.SessionState;
import work.lcod.scoring.session.graal.GraalJsEmbeddingService;

/**
 * Public entry point for scoring rows against a deployed model.
 *
 * <p>One instance owns one embedded session and may be shared by concurrent callers. {@link #score(Map)} never
 * throws for bad input or runtime failures: those come back as a non-zero {@link ScoreResult#status()}.
 */
public final class ModelScorer implements AutoCloseable {
    private final DeploymentDescriptor deployment;
    private final FeatureNormalizer normalizer;
    private final SessionManager sessions;
    private final ModelInvoker invoker;
    private final ScoreReporter reporter;

    public ModelScorer(DeploymentDescriptor deployment, EmbeddingService service, DiagnosticSink sink) {
        this.deployment = Objects.requireNonNull(deployment, "deployment");
        Objects.requireNonNull(service, "service");
        this.reporter = new ScoreReporter(deployment.moduleId(), deployment.outputNames(), sink);
        this.normalizer = new FeatureNormalizer(deployment.imputationTable());
        this.sessions = new SessionManager(
            service,
            () -> ScoringProgram.fromArtifact(
                deployment.artifact(),
                deployment.moduleId(),
                deployment.routineName(),
                deployment.imputationTable(),
                deployment.outputNames()
            ),
            deployment.moduleId(),
            reporter
        );
        this.invoker = new ModelInvoker(
            service,
            deployment.routineName(),
            deployment.imputationTable(),
            deployment.outputNames(),
            reporter
        );
    }

    /** Scorer running the artifact in a GraalJS session and logging through SLF4J. */
    public static ModelScorer create(DeploymentDescriptor deployment) {
        return new ModelScorer(deployment, new GraalJsEmbeddingService(), new Slf4jDiagnosticSink());
    }

    public ScoreResult score(Map<String, ?> row) {
        FeatureRecord record = normalizer.normalize(row);
        try {
            ScoringSession session = sessions.acquire();
            return invoker.invoke(session, record);
        } catch (ScoringFailure failure) {
            return reporter.failure(failure);
        } catch (RuntimeException ex) {
            return reporter.unexpected(ex);
        }
    }

    public FeatureRecord normalize(Map<String, ?> row) {
        return normalizer.normalize(row);
    }

    public SessionState sessionState() {
        return sessions.state();
    }

    public DeploymentDescriptor deployment() {
        return deployment;
    }

    @Override
    public void close() {
        sessions.close();
    }
}
