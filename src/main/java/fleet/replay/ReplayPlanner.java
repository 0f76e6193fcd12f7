package fleet.replay;

import fleet.model.Recording;
import fleet.model.SessionRecord;
import fleet.model.TaskSnapshot;
import fleet.task.ActionKind;
import fleet.task.BrowserTask;
import fleet.task.StandardActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a loaded {@link Recording} into replay steps without touching any
 * session.
 *
 * <p>Each snapshot is dispatched on its action kind. {@code navigate},
 * {@code click}, {@code fill} and {@code scroll} become tasks running the
 * matching {@link StandardActions} body with the recorded parameters.
 * Everything else ({@code wait}, {@code custom}, unknown kinds) becomes a skip
 * step: a recording never fails a replay because of one step it cannot rebuild.
 */
public final class ReplayPlanner {

    private static final Logger log = LoggerFactory.getLogger(ReplayPlanner.class);

    static final String NAME_PREFIX        = "replay_";
    static final String DESCRIPTION_PREFIX = "Replay: ";

    private ReplayPlanner() { }

    /**
     * @param recording         the loaded recording
     * @param availableSessions sessions created for the replay; records with an
     *                          index at or beyond this are skipped
     */
    public static ReplayPlan plan(Recording recording, int availableSessions) {
        List<ReplayStep> steps = new ArrayList<>();
        List<Integer> skippedSessions = new ArrayList<>();

        for (SessionRecord record : recording.getSessions()) {
            int index = record.getSessionIndex();
            if (index < 0 || index >= availableSessions) {
                log.warn("Session index {} out of range ({} session(s) available), skipping its {} task(s)",
                        index, availableSessions, record.getTaskCount());
                skippedSessions.add(index);
                continue;
            }
            for (TaskSnapshot snapshot : record.getTasks()) {
                ReplayStep step = reconstruct(snapshot, index);
                if (step.isSkip()) {
                    log.warn("Session {}: skipping task '{}': {}", index, snapshot.getName(), step.skipReason());
                }
                steps.add(step);
            }
        }

        ReplayPlan plan = new ReplayPlan(steps, skippedSessions);
        log.info("Replay plan for run '{}': {}", recording.getRunId(), plan);
        return plan;
    }

    /** Rebuilds one snapshot for {@code sessionIndex}, or returns a skip step. */
    public static ReplayStep reconstruct(TaskSnapshot snapshot, int sessionIndex) {
        Optional<ActionKind> kind = snapshot.kind();
        if (kind.isEmpty()) {
            return ReplayStep.skip(sessionIndex, snapshot.getName(),
                    "unknown action kind '" + snapshot.getActionKind() + "'");
        }

        return switch (kind.get()) {
            case NAVIGATE -> {
                if (snapshot.getArgs().isEmpty() || snapshot.getArgs().get(0) == null) {
                    yield ReplayStep.skip(sessionIndex, snapshot.getName(), "navigate task has no url");
                }
                yield rebuilt(snapshot, sessionIndex, ActionKind.NAVIGATE);
            }
            case CLICK, FILL -> {
                if (snapshot.getArgs().isEmpty() || snapshot.getArgs().get(0) == null) {
                    yield ReplayStep.skip(sessionIndex, snapshot.getName(),
                            kind.get().wireName() + " task has no selector");
                }
                yield rebuilt(snapshot, sessionIndex, kind.get());
            }
            case SCROLL -> rebuilt(snapshot, sessionIndex, ActionKind.SCROLL);
            case WAIT, CUSTOM -> ReplayStep.skip(sessionIndex, snapshot.getName(),
                    "action kind '" + kind.get().wireName() + "' is not replayable");
        };
    }

    private static ReplayStep rebuilt(TaskSnapshot snapshot, int sessionIndex, ActionKind kind) {
        String description = snapshot.getDescription() != null ? snapshot.getDescription() : snapshot.getName();
        BrowserTask task = new BrowserTask(
                NAME_PREFIX + snapshot.getName(),
                kind,
                DESCRIPTION_PREFIX + description,
                snapshot.getArgs(),
                snapshot.getKwargs(),
                StandardActions.forKind(kind));
        return ReplayStep.run(sessionIndex, snapshot.getName(), task);
    }
}
