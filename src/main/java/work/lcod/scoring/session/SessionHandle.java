package work.lcod.scoring.session;

/**
 * Opaque handle to one embedded execution context, owned by the {@link EmbeddingService} that created it.
 */
public interface SessionHandle extends AutoCloseable {
    boolean isOpen();

    @Override
    void close();
}
