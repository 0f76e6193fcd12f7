package fleet.replay;

import fleet.orchestrator.ExecutionReport;

import java.util.List;

/**
 * Summary of one replay run.
 *
 * @param runId             run id of the replayed recording
 * @param sessionsRequested {@code session_count} of the recording
 * @param sessionsCreated   sessions actually launched for the replay
 * @param tasksSubmitted    reconstructed tasks handed to the scheduler
 * @param skippedSteps      snapshots that could not be rebuilt
 * @param skippedSessions   record indices beyond the sessions created
 * @param execution         outcome of running the submitted tasks
 */
public record ReplayReport(String runId, int sessionsRequested, int sessionsCreated, int tasksSubmitted,
                           List<ReplayStep> skippedSteps, List<Integer> skippedSessions,
                           ExecutionReport execution) {

    public ReplayReport {
        skippedSteps    = List.copyOf(skippedSteps);
        skippedSessions = List.copyOf(skippedSessions);
    }

    public boolean isAllSucceeded() {
        return execution.isAllSucceeded();
    }

    @Override
    public String toString() {
        return String.format("ReplayReport{run='%s', sessions=%d/%d, submitted=%d, skippedSteps=%d, "
                        + "skippedSessions=%s, %s}",
                runId, sessionsCreated, sessionsRequested, tasksSubmitted, skippedSteps.size(),
                skippedSessions, execution);
    }
}
