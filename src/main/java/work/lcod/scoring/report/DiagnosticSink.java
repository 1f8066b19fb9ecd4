package work.lcod.scoring.report;

/**
 * Receives pipeline diagnostics. Implementations must be thread-safe.
 */
@FunctionalInterface
public interface DiagnosticSink {
    void emit(Diagnostic diagnostic);
}
