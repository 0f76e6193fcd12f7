package fleet.interactive;

import java.util.Map;

/**
 * Snapshot of a {@link PeriodicClickScheduler} loop.
 *
 * @param state     lifecycle state
 * @param ticks     completed ticks
 * @param attempts  click attempts per session index (successful or not)
 * @param clicks    successful clicks per session index
 * @param errors    errors counted against the loop's budget
 * @param lastError message of the most recent error, or null
 */
public record ClickLoopStatus(State state, int ticks, Map<Integer, Integer> attempts,
                              Map<Integer, Integer> clicks, int errors, String lastError) {

    public enum State {
        /** Never started. */
        IDLE,
        RUNNING,
        /** Stopped on request. */
        STOPPED,
        /** Stopped itself after reaching the error budget. */
        ERROR_BUDGET_EXHAUSTED
    }

    public ClickLoopStatus {
        attempts = Map.copyOf(attempts);
        clicks   = Map.copyOf(clicks);
    }

    public int attemptsFor(int sessionIndex) {
        return attempts.getOrDefault(sessionIndex, 0);
    }

    public int clicksFor(int sessionIndex) {
        return clicks.getOrDefault(sessionIndex, 0);
    }
}
