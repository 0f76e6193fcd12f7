package fleet.orchestrator;

/** What a session worker does with its remaining chain after a task fails. */
public enum ErrorPolicy {
    /** Log the failure and run the next queued task. */
    CONTINUE,
    /** Log the failure and skip every remaining task of that session. */
    ABORT_CHAIN
}
