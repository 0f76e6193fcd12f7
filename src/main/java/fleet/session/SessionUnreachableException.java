package fleet.session;

import fleet.FleetException;

/**
 * Raised when a session handle went stale: the browser quit, the window was
 * closed or the driver connection dropped.
 */
public class SessionUnreachableException extends FleetException {

    public SessionUnreachableException(String msg) {
        super(msg);
    }

    public SessionUnreachableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
