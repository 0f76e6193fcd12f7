package fleet.replay;

import fleet.task.BrowserTask;

/**
 * One planned replay step: either a reconstructed task bound to its original
 * session index, or a skip with the reason it cannot be replayed.
 *
 * @param sessionIndex session the recorded task ran in
 * @param sourceName   name of the recorded task
 * @param task         reconstructed task, or null for a skip
 * @param skipReason   why the step is skipped, or null
 */
public record ReplayStep(int sessionIndex, String sourceName, BrowserTask task, String skipReason) {

    public static ReplayStep run(int sessionIndex, String sourceName, BrowserTask task) {
        return new ReplayStep(sessionIndex, sourceName, task, null);
    }

    public static ReplayStep skip(int sessionIndex, String sourceName, String reason) {
        return new ReplayStep(sessionIndex, sourceName, null, reason);
    }

    public boolean isSkip() {
        return task == null;
    }
}
