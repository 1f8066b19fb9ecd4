package work.lcod.scoring.session;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A published session: the handle plus the revision and module it was published under.
 */
public final class ScoringSession {
    private final SessionHandle handle;
    private final String moduleId;
    private final int revision;
    private final ReentrantLock invocationLock = new ReentrantLock();

    ScoringSession(SessionHandle handle, String moduleId, int revision) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.moduleId = Objects.requireNonNull(moduleId, "moduleId");
        this.revision = revision;
    }

    public SessionHandle handle() {
        return handle;
    }

    public String moduleId() {
        return moduleId;
    }

    public int revision() {
        return revision;
    }

    /** Serializes bind/execute/read sequences on this session. */
    public ReentrantLock invocationLock() {
        return invocationLock;
    }
}
