package fleet.interactive;

import fleet.session.SessionHandle;

import java.util.Objects;

/**
 * One session/coordinate pair driven by the {@link PeriodicClickScheduler}.
 *
 * @param sessionIndex index of the session
 * @param handle       the session's handle
 * @param windowToken  window the coordinate was picked in
 * @param x            viewport x
 * @param y            viewport y
 */
public record ClickTarget(int sessionIndex, SessionHandle handle, String windowToken, long x, long y) {

    public ClickTarget {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(windowToken, "windowToken");
    }
}
