package work.lcod.scoring.report;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scoring.api.LogLevel;

/**
 * Forwards diagnostics to SLF4J, dropping entries below the configured threshold.
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {
    private static final Logger LOG = LoggerFactory.getLogger("work.lcod.scoring");

    private final Logger logger;
    private final LogLevel threshold;

    public Slf4jDiagnosticSink() {
        this(LOG, LogLevel.TRACE);
    }

    public Slf4jDiagnosticSink(LogLevel threshold) {
        this(LOG, threshold);
    }

    Slf4jDiagnosticSink(Logger logger, LogLevel threshold) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    @Override
    public void emit(Diagnostic diagnostic) {
        if (!diagnostic.level().isAtLeast(threshold)) {
            return;
        }
        String line = diagnostic.render();
        switch (diagnostic.level()) {
            case TRACE -> logger.trace(line);
            case DEBUG -> logger.debug(line);
            case INFO -> logger.info(line);
            case WARN -> logger.warn(line);
            case ERROR, FATAL -> logger.error(line);
        }
    }
}
