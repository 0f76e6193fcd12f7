package fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fleet.task.BrowserTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered history of the tasks that completed successfully against one
 * session, plus the session's creation metadata.
 *
 * <p>A live record is append-only and is written by the single worker that
 * owns its session. Copies taken with {@link #freeze()} and records read
 * from a file are frozen: {@link #capture} rejects them.
 */
@JsonPropertyOrder({"session_index", "initial_location", "created_at", "tasks"})
public final class SessionRecord {

    private static final Logger log = LoggerFactory.getLogger(SessionRecord.class);

    /** Location recorded for sessions created without an initial location. */
    public static final String BLANK_LOCATION = "about:blank";

    private final int sessionIndex;
    private final String initialLocation;
    private final Instant createdAt;
    private final List<TaskSnapshot> tasks;
    private final boolean frozen;

    /** Creates a live, empty record for a newly created session. */
    public SessionRecord(int sessionIndex, String initialLocation) {
        this(sessionIndex, initialLocation, Instant.now(), List.of(), false);
    }

    @JsonCreator
    SessionRecord(@JsonProperty("session_index") int sessionIndex,
                  @JsonProperty("initial_location") String initialLocation,
                  @JsonProperty("created_at") Instant createdAt,
                  @JsonProperty("tasks") List<TaskSnapshot> tasks) {
        this(sessionIndex, initialLocation, createdAt, tasks, true);
    }

    private SessionRecord(int sessionIndex, String initialLocation, Instant createdAt,
                          List<TaskSnapshot> tasks, boolean frozen) {
        this.sessionIndex    = sessionIndex;
        this.initialLocation = isBlankLocation(initialLocation) ? BLANK_LOCATION : initialLocation;
        this.createdAt       = createdAt;
        this.tasks           = new CopyOnWriteArrayList<>(tasks != null ? tasks : List.of());
        this.frozen          = frozen;
    }

    // ── Capture ───────────────────────────────────────────────────────────

    /**
     * Appends a snapshot of {@code task}. Call only after
     * {@link BrowserTask#execute} returned normally.
     *
     * @throws IllegalArgumentException if the task did not complete successfully
     * @throws IllegalStateException    if this record is frozen
     */
    public TaskSnapshot capture(BrowserTask task) {
        if (frozen) {
            throw new IllegalStateException("Session record " + sessionIndex + " is frozen");
        }
        if (!task.isCompleted() || task.getError() != null) {
            throw new IllegalArgumentException("Task '" + task.getName()
                    + "' did not complete successfully and cannot be captured");
        }
        TaskSnapshot snapshot = TaskSnapshot.of(task, sessionIndex);
        tasks.add(snapshot);
        log.debug("Captured task '{}' into session {} history ({} total)",
                task.getName(), sessionIndex, tasks.size());
        return snapshot;
    }

    /** Returns an immutable copy of this record's current contents. */
    public SessionRecord freeze() {
        return new SessionRecord(sessionIndex, initialLocation, createdAt, List.copyOf(tasks), true);
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("session_index")    public int                getSessionIndex()    { return sessionIndex; }
    @JsonProperty("initial_location") public String             getInitialLocation() { return initialLocation; }
    @JsonProperty("created_at")       public Instant            getCreatedAt()       { return createdAt; }
    @JsonProperty("tasks")            public List<TaskSnapshot> getTasks()           { return Collections.unmodifiableList(tasks); }

    @JsonIgnore public boolean isFrozen()               { return frozen; }
    @JsonIgnore public int     getTaskCount()           { return tasks.size(); }
    @JsonIgnore public boolean hasInitialLocation()     { return !isBlankLocation(initialLocation); }

    /** True for null, blank and {@code about:blank}. */
    public static boolean isBlankLocation(String location) {
        return location == null || location.isBlank() || BLANK_LOCATION.equalsIgnoreCase(location.trim());
    }

    @Override
    public String toString() {
        return String.format("SessionRecord{index=%d, initial='%s', tasks=%d}",
                sessionIndex, initialLocation, tasks.size());
    }
}
