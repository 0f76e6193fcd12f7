package fleet.session;

import java.time.Duration;
import java.util.Set;

/**
 * Opaque handle to one running automation target (one controlled browser).
 *
 * <p>A handle is not safe for concurrent interaction. The orchestrator
 * guarantees that at most one worker drives a given handle at any time.
 *
 * <p>Operations against a handle whose browser or window has gone away throw
 * {@link SessionUnreachableException}.
 */
public interface SessionHandle {

    /** Navigates the active window to {@code url} and waits for the page to load. */
    void navigate(String url);

    /**
     * Waits up to {@code timeout} for the element to be clickable, then clicks it.
     */
    void click(String selector, LocatorKind by, Duration timeout);

    /**
     * Waits up to {@code timeout} for the element to be clickable, clears it and
     * types {@code text}.
     */
    void fill(String selector, String text, LocatorKind by, Duration timeout);

    /**
     * Runs a JavaScript snippet in the active window. Arguments are exposed to the
     * script as {@code arguments[i]}.
     *
     * @return the script's return value as mapped by the driver (may be null)
     */
    Object runScript(String script, Object... args);

    /** Dispatches a native pointer click at the given viewport coordinate. */
    void pointerClick(long x, long y);

    /** Current URL of the active window. */
    String currentLocation();

    /** Tokens of every open window/tab of this session. */
    Set<String> windowTokens();

    /** Token of the active window. */
    String currentWindowToken();

    /** Makes {@code windowToken} the active window. */
    void focus(String windowToken);

    /** Moves the session's window on screen. No-op for headless sessions. */
    void position(int x, int y);

    /** Releases the underlying browser. */
    void close();
}
