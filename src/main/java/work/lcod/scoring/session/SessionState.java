package work.lcod.scoring.session;

/**
 * Lifecycle of the scorer's embedded session.
 */
public enum SessionState {
    UNINITIALIZED,
    LOADING,
    READY,
    FAILED
}
