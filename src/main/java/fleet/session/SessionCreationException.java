package fleet.session;

import fleet.FleetException;

/**
 * Raised when a single session cannot be started or made ready.
 * The orchestrator logs it and continues with fewer sessions.
 */
public class SessionCreationException extends FleetException {

    private final int sessionIndex;

    public SessionCreationException(int sessionIndex, String msg, Throwable cause) {
        super("Session " + sessionIndex + ": " + msg, cause);
        this.sessionIndex = sessionIndex;
    }

    public int getSessionIndex() { return sessionIndex; }
}
