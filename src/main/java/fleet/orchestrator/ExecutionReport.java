package fleet.orchestrator;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Result of one {@code executeAll()} call: every task's outcome, grouped by
 * session in execution order, and the recording saved afterwards (if any).
 */
public final class ExecutionReport {

    private final List<TaskOutcome> outcomes;
    private final Path recordingPath;

    public ExecutionReport(List<TaskOutcome> outcomes, Path recordingPath) {
        this.outcomes      = List.copyOf(outcomes);
        this.recordingPath = recordingPath;
    }

    static ExecutionReport empty() {
        return new ExecutionReport(List.of(), null);
    }

    ExecutionReport withRecording(Path path) {
        return new ExecutionReport(outcomes, path);
    }

    public List<TaskOutcome> getOutcomes()      { return outcomes; }
    /** Saved recording, or null when recording is disabled or nothing ran. */
    public Path              getRecordingPath() { return recordingPath; }

    public long count(TaskOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean isAllSucceeded() {
        return outcomes.stream().allMatch(TaskOutcome::isSuccess);
    }

    public List<TaskOutcome> getFailures() {
        return outcomes.stream().filter(o -> o.status() == TaskOutcome.Status.FAILED).toList();
    }

    /** Outcomes per session index, each list in execution order. */
    public Map<Integer, List<TaskOutcome>> bySession() {
        return outcomes.stream().collect(Collectors.groupingBy(TaskOutcome::sessionIndex,
                TreeMap::new, Collectors.toList()));
    }

    @Override
    public String toString() {
        return String.format("ExecutionReport{tasks=%d, succeeded=%d, failed=%d, skipped=%d, recording=%s}",
                outcomes.size(), count(TaskOutcome.Status.SUCCEEDED), count(TaskOutcome.Status.FAILED),
                count(TaskOutcome.Status.SKIPPED), recordingPath);
    }
}
