package work.lcod.scoring.report;

/**
 * Pipeline stage at which a scoring call failed.
 */
public enum FailureStage {
    INITIALIZE,
    SELECT,
    BIND,
    EXECUTE,
    INTERNAL
}
