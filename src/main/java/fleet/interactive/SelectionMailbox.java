package fleet.interactive;

import fleet.session.SessionHandle;

import java.util.Optional;

/**
 * Single-slot handoff between the page and the host: the page writes at most
 * one selection per {@link #install}, the host drains it with {@link #take}.
 */
public interface SelectionMailbox {

    /** Installs the capture overlay and empties the slot. */
    void install(SessionHandle handle, int sessionIndex);

    /**
     * Reads the slot and clears it in the same step.
     *
     * @return the selected point, or empty when nothing was selected yet
     */
    Optional<ViewportPoint> take(SessionHandle handle);

    /** Removes any overlay, listener or banner left on the page. Idempotent. */
    void remove(SessionHandle handle);
}
