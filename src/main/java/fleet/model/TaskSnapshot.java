package fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fleet.task.ActionKind;
import fleet.task.BrowserTask;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable captured form of a successfully executed {@link BrowserTask}, as
 * stored in a {@link SessionRecord} and in recording files.
 *
 * <p>{@code action_kind} is kept as the raw wire string so that a file written
 * by a newer or foreign tool still loads; {@link #kind()} maps it to the closed
 * {@link ActionKind} set.
 */
@JsonPropertyOrder({"name", "action_kind", "description", "args", "kwargs", "completed",
        "execution_time_seconds", "session_index", "timestamp"})
public final class TaskSnapshot {

    private final String name;
    private final String actionKind;
    private final String description;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final boolean completed;
    private final Double executionTimeSeconds;
    private final int sessionIndex;
    private final Instant timestamp;

    @JsonCreator
    public TaskSnapshot(@JsonProperty("name") String name,
                        @JsonProperty("action_kind") String actionKind,
                        @JsonProperty("description") String description,
                        @JsonProperty("args") List<Object> args,
                        @JsonProperty("kwargs") Map<String, Object> kwargs,
                        @JsonProperty("completed") boolean completed,
                        @JsonProperty("execution_time_seconds") Double executionTimeSeconds,
                        @JsonProperty("session_index") int sessionIndex,
                        @JsonProperty("timestamp") Instant timestamp) {
        this.name                 = name;
        this.actionKind           = actionKind;
        this.description          = description;
        this.args                 = Collections.unmodifiableList(JsonValues.filterArgs(args));
        this.kwargs               = Collections.unmodifiableMap(JsonValues.filterKwargs(
                kwargs != null ? kwargs : new LinkedHashMap<>()));
        this.completed            = completed;
        this.executionTimeSeconds = executionTimeSeconds;
        this.sessionIndex         = sessionIndex;
        this.timestamp            = timestamp;
    }

    /**
     * Captures {@code task} for session {@code sessionIndex}, stamping the
     * current wall-clock time. Non-representable parameters are dropped.
     */
    public static TaskSnapshot of(BrowserTask task, int sessionIndex) {
        return new TaskSnapshot(task.getName(), task.getActionKind().wireName(), task.getDescription(),
                task.getArgs(), task.getKwargs(), task.isCompleted(),
                roundSeconds(task.getElapsed()), sessionIndex, Instant.now());
    }

    private static Double roundSeconds(Duration elapsed) {
        if (elapsed == null) return null;
        return BigDecimal.valueOf(elapsed.toNanos(), 9).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("name")                   public String              getName()                 { return name; }
    @JsonProperty("action_kind")            public String              getActionKind()           { return actionKind; }
    @JsonProperty("description")            public String              getDescription()          { return description; }
    @JsonProperty("args")                   public List<Object>        getArgs()                 { return args; }
    @JsonProperty("kwargs")                 public Map<String, Object> getKwargs()               { return kwargs; }
    @JsonProperty("completed")              public boolean             isCompleted()             { return completed; }
    @JsonProperty("execution_time_seconds") public Double              getExecutionTimeSeconds() { return executionTimeSeconds; }
    @JsonProperty("session_index")          public int                 getSessionIndex()         { return sessionIndex; }
    @JsonProperty("timestamp")              public Instant             getTimestamp()            { return timestamp; }

    /** The action kind, or empty when the recorded value is not a known kind. */
    @JsonIgnore
    public Optional<ActionKind> kind() {
        return ActionKind.fromWire(actionKind);
    }

    @Override
    public String toString() {
        return String.format("TaskSnapshot{name='%s', kind=%s, session=%d, args=%s}",
                name, actionKind, sessionIndex, args);
    }
}
