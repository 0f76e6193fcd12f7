package fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, replayable snapshot of every session's task history from one run.
 * Maps 1:1 to the root object defined in {@code recording-schema.json}.
 */
@JsonPropertyOrder({"run_id", "created_at", "session_count", "sessions"})
public final class Recording {

    /** Prefix of recording file names: {@code browser_session_{runId}.json}. */
    public static final String FILE_PREFIX    = "browser_session_";
    public static final String FILE_EXTENSION = ".json";

    private static final DateTimeFormatter RUN_ID_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    private final String runId;
    private final Instant createdAt;
    private final int sessionCount;
    private final List<SessionRecord> sessions;

    @JsonCreator
    public Recording(@JsonProperty("run_id") String runId,
                     @JsonProperty("created_at") Instant createdAt,
                     @JsonProperty("session_count") int sessionCount,
                     @JsonProperty("sessions") List<SessionRecord> sessions) {
        this.runId        = Objects.requireNonNull(runId, "run_id");
        this.createdAt    = createdAt;
        this.sessionCount = sessionCount;
        this.sessions     = sessions != null
                ? sessions.stream().map(s -> s.isFrozen() ? s : s.freeze()).toList()
                : List.of();
    }

    /**
     * Captures the current state of {@code records}. Each record is frozen, so
     * later task captures do not leak into the recording.
     */
    public static Recording capture(String runId, int sessionCount, Collection<SessionRecord> records) {
        return new Recording(runId, Instant.now(), sessionCount,
                records.stream().map(SessionRecord::freeze).toList());
    }

    /** A time-derived run id, e.g. {@code 20261018_075012}. */
    public static String newRunId(Instant at) {
        return RUN_ID_FMT.format(at);
    }

    /** File name this recording is saved under. */
    public static String fileNameFor(String runId) {
        return FILE_PREFIX + runId + FILE_EXTENSION;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    @JsonProperty("run_id")        public String              getRunId()        { return runId; }
    @JsonProperty("created_at")    public Instant             getCreatedAt()    { return createdAt; }
    @JsonProperty("session_count") public int                 getSessionCount() { return sessionCount; }
    @JsonProperty("sessions")      public List<SessionRecord> getSessions()     { return sessions; }

    @JsonIgnore
    public String getFileName() {
        return fileNameFor(runId);
    }

    @JsonIgnore
    public int getTaskCount() {
        return sessions.stream().mapToInt(SessionRecord::getTaskCount).sum();
    }

    public Optional<SessionRecord> session(int index) {
        return sessions.stream().filter(s -> s.getSessionIndex() == index).findFirst();
    }

    @Override
    public String toString() {
        return String.format("Recording{runId='%s', sessions=%d, tasks=%d}", runId, sessionCount, getTaskCount());
    }
}
