package fleet.replay;

import fleet.orchestrator.Submission;

import java.util.List;

/**
 * Ordered replay steps of one recording plus the session records left out
 * because their index is beyond the sessions available.
 */
public final class ReplayPlan {

    private final List<ReplayStep> steps;
    private final List<Integer> skippedSessions;

    public ReplayPlan(List<ReplayStep> steps, List<Integer> skippedSessions) {
        this.steps           = List.copyOf(steps);
        this.skippedSessions = List.copyOf(skippedSessions);
    }

    public List<ReplayStep> getSteps()           { return steps; }
    public List<Integer>    getSkippedSessions() { return skippedSessions; }

    /** Runnable steps as scheduler submissions, in recorded order. */
    public List<Submission> toSubmissions() {
        return steps.stream()
                .filter(s -> !s.isSkip())
                .map(s -> new Submission(s.task(), s.sessionIndex()))
                .toList();
    }

    public List<ReplayStep> getSkippedSteps() {
        return steps.stream().filter(ReplayStep::isSkip).toList();
    }

    public int getRunnableCount() {
        return (int) steps.stream().filter(s -> !s.isSkip()).count();
    }

    @Override
    public String toString() {
        return String.format("ReplayPlan{runnable=%d, skippedSteps=%d, skippedSessions=%s}",
                getRunnableCount(), getSkippedSteps().size(), skippedSessions);
    }
}
