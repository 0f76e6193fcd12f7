package fleet.orchestrator;

import fleet.task.BrowserTask;

import java.util.Objects;

/**
 * A task addressed to a session index, in the order it was submitted.
 */
public record Submission(BrowserTask task, int sessionIndex) {

    public Submission {
        Objects.requireNonNull(task, "task");
        if (sessionIndex < 0) {
            throw new IllegalArgumentException("Session index must be >= 0, got " + sessionIndex);
        }
    }
}
