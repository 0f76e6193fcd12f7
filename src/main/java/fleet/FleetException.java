package fleet;

/**
 * Unchecked exception thrown by fleet components when an operation against a
 * session, a task or a recording cannot be completed.
 *
 * <p>Subclasses narrow the failure down to session creation, task execution,
 * an unreachable session or a missing recording. Every message carries enough
 * context (session index, task name, path) to locate the failure.
 */
public class FleetException extends RuntimeException {

    public FleetException(String msg) {
        super(msg);
    }

    public FleetException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
