package fleet.session;

/**
 * Creates one session handle. Implementations decide how the browser is
 * physically started.
 */
public interface SessionFactory {

    /**
     * Starts a new session.
     *
     * @param index    zero-based index the orchestrator will assign to it
     * @param kind     browser engine
     * @param headless whether to start without a visible window
     * @return a ready handle
     * @throws SessionCreationException if the browser could not be started
     */
    SessionHandle create(int index, BrowserKind kind, boolean headless);
}
