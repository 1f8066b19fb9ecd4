package work.lcod.scoring.session;

/**
 * Capability interface of the runtime that hosts the scoring program. Any runtime offering these operations
 * (in-process interpreter, subprocess, model server) can back the scorer.
 *
 * <p>Status-returning operations report {@code 0} on success and a runtime-specific non-zero code otherwise.
 */
public interface EmbeddingService {
    SessionHandle createSession();

    void appendSourceLine(SessionHandle session, String line);

    /**
     * Builds {@code sourceText} inside the session under {@code moduleId}.
     *
     * @return the published revision; values below {@code 1} mean the program was not published
     */
    int publish(SessionHandle session, String sourceText, String moduleId);

    int selectRoutine(SessionHandle session, String routineName);

    int bindNumeric(SessionHandle session, String name, double value);

    int bindText(SessionHandle session, String name, String value);

    int execute(SessionHandle session);

    String readText(SessionHandle session, String name);

    double readNumeric(SessionHandle session, String name);

    /** Whether two executes may run at the same time on one session. */
    default boolean supportsConcurrentExecute() {
        return false;
    }
}
