package work.lcod.scoring.session;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import work.lcod.scoring.api.ScoreResult;
import work.lcod.scoring.report.FailureStage;
import work.lcod.scoring.report.ScoreReporter;
import work.lcod.scoring.report.ScoringFailure;

/**
 * Owns the scorer's single embedded session and publishes the scoring program into it on first use.
 *
 * <p>Initialization is serialized: concurrent first calls wait for the loading caller and then observe either
 * {@link SessionState#READY} or {@link SessionState#FAILED}. A failed initialization is retried by the next call.
 */
public final class SessionManager implements AutoCloseable {
    private final EmbeddingService service;
    private final Supplier<ScoringProgram> programSupplier;
    private final String moduleId;
    private final ScoreReporter reporter;
    private final ReentrantLock initLock = new ReentrantLock();
    private final AtomicInteger loadAttempts = new AtomicInteger();
    private volatile Snapshot snapshot = new Snapshot(SessionState.UNINITIALIZED, null);

    public SessionManager(
        EmbeddingService service,
        Supplier<ScoringProgram> programSupplier,
        String moduleId,
        ScoreReporter reporter
    ) {
        this.service = Objects.requireNonNull(service, "service");
        this.programSupplier = Objects.requireNonNull(programSupplier, "programSupplier");
        this.moduleId = Objects.requireNonNull(moduleId, "moduleId");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /**
     * Returns the ready session, loading it first when needed.
     *
     * @throws ScoringFailure with status {@code -1} when the program could not be published
     */
    public ScoringSession acquire() throws ScoringFailure {
        Snapshot current = snapshot;
        if (current.state() == SessionState.READY) {
            return current.session();
        }
        initLock.lock();
        try {
            current = snapshot;
            if (current.state() == SessionState.READY) {
                return current.session();
            }
            snapshot = new Snapshot(SessionState.LOADING, null);
            ScoringSession session = null;
            try {
                session = load();
                snapshot = new Snapshot(SessionState.READY, session);
                return session;
            } finally {
                if (session == null) {
                    snapshot = new Snapshot(SessionState.FAILED, null);
                }
            }
        } finally {
            initLock.unlock();
        }
    }

    public SessionState state() {
        return snapshot.state();
    }

    /** Number of times the loading step has run, successful or not. */
    public int loadAttempts() {
        return loadAttempts.get();
    }

    public EmbeddingService service() {
        return service;
    }

    @Override
    public void close() {
        initLock.lock();
        try {
            ScoringSession session = snapshot.session();
            snapshot = new Snapshot(SessionState.UNINITIALIZED, null);
            if (session != null) {
                session.invocationLock().lock();
                try {
                    session.handle().close();
                } finally {
                    session.invocationLock().unlock();
                }
            }
        } finally {
            initLock.unlock();
        }
    }

    private ScoringSession load() throws ScoringFailure {
        loadAttempts.incrementAndGet();
        SessionHandle handle = null;
        try {
            ScoringProgram program = programSupplier.get();
            handle = service.createSession();
            for (String line : program.lines()) {
                service.appendSourceLine(handle, line);
            }
            int revision = service.publish(handle, program.text(), moduleId);
            if (revision < 1) {
                ScoringFailure failure = new ScoringFailure(
                    ScoreResult.STATUS_PUBLISH_FAILED,
                    FailureStage.INITIALIZE,
                    "Scoring program was not published (revision " + revision + ")"
                );
                discard(handle, failure);
                throw failure;
            }
            reporter.published(revision);
            return new ScoringSession(handle, moduleId, revision);
        } catch (RuntimeException | LinkageError ex) {
            ScoringFailure failure = new ScoringFailure(
                ScoreResult.STATUS_PUBLISH_FAILED,
                FailureStage.INITIALIZE,
                "Unable to initialize scoring session",
                ex
            );
            discard(handle, failure);
            throw failure;
        }
    }

    private static void discard(SessionHandle handle, ScoringFailure failure) {
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (RuntimeException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private record Snapshot(SessionState state, ScoringSession session) {}
}
