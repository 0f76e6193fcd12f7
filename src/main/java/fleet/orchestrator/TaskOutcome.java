package fleet.orchestrator;

import java.time.Duration;

/**
 * What happened to one submitted task.
 *
 * @param sessionIndex session the task was addressed to
 * @param taskName     the task's name
 * @param status       final status
 * @param error        failure message, null unless {@code status == FAILED}
 * @param elapsed      run time, null for skipped tasks
 */
public record TaskOutcome(int sessionIndex, String taskName, Status status, String error, Duration elapsed) {

    public enum Status { SUCCEEDED, FAILED, SKIPPED }

    public boolean isSuccess() { return status == Status.SUCCEEDED; }
}
