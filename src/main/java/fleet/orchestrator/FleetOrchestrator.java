package fleet.orchestrator;

import fleet.interactive.CancellationToken;
import fleet.interactive.ClickLoopStatus;
import fleet.interactive.ClickTarget;
import fleet.interactive.CoordinateBridge;
import fleet.interactive.CoordinateClicker;
import fleet.interactive.PeriodicClickScheduler;
import fleet.interactive.ScriptMailbox;
import fleet.interactive.SelectionCallback;
import fleet.interactive.SelectionMailbox;
import fleet.interactive.ViewportPoint;
import fleet.model.Recording;
import fleet.model.RecordingIO;
import fleet.model.SessionRecord;
import fleet.replay.ReplayPlan;
import fleet.replay.ReplayPlanner;
import fleet.replay.ReplayReport;
import fleet.session.BrowserKind;
import fleet.session.SessionCreationException;
import fleet.session.SessionFactory;
import fleet.session.SessionHandle;
import fleet.task.BrowserTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns a fleet of browser sessions and everything attached to them: the
 * pending task queue, the per-session records, the coordinate bridge and the
 * periodic clicker.
 *
 * <p>Typical use:
 * <pre>{@code
 * try (FleetOrchestrator fleet = new FleetOrchestrator(factory, new FleetConfig())) {
 *     fleet.createSessions(2, BrowserKind.CHROME, false, List.of("https://example.org", "about:blank"));
 *     fleet.addTask(StandardActions.navigate("open", "https://example.com"), 1);
 *     ExecutionReport report = fleet.executeAll();
 * }
 * }</pre>
 *
 * <p>The orchestrator itself is driven from one thread. Tasks run on the
 * scheduler's workers, selection polls on the bridge's threads and the click
 * loop on its own thread.
 */
public class FleetOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FleetOrchestrator.class);

    private final SessionFactory factory;
    private final FleetConfig config;
    private final String runId;
    private final ChainScheduler scheduler;
    private final CoordinateBridge bridge;
    private final PeriodicClickScheduler clickScheduler;
    private final CancellationToken rootToken = new CancellationToken();

    private final List<ManagedSession> sessions = new ArrayList<>();
    private final List<Submission> pending = new ArrayList<>();
    private final Map<Integer, ClickTarget> pickedTargets = new ConcurrentHashMap<>();
    private boolean closed;

    // ── Constructors ──────────────────────────────────────────────────────

    public FleetOrchestrator(SessionFactory factory, FleetConfig config) {
        this(factory, config, new ScriptMailbox(), new CoordinateClicker());
    }

    /**
     * Package-private constructor for tests: lets the selection mailbox and
     * clicker be replaced so no page scripts are needed.
     */
    FleetOrchestrator(SessionFactory factory, FleetConfig config,
                      SelectionMailbox mailbox, CoordinateClicker clicker) {
        this.factory        = factory;
        this.config         = config;
        this.runId          = Recording.newRunId(Instant.now());
        this.scheduler      = new ChainScheduler(config.getMaxWorkers(), config.getErrorPolicy());
        this.bridge         = new CoordinateBridge(mailbox, config.getPollInterval(), config.getPollMaxAttempts());
        this.clickScheduler = new PeriodicClickScheduler(clicker, config.getClickMaxErrors(), config.getCloseGrace());
        log.info("Fleet orchestrator ready (run {}, recording {})",
                runId, config.isRecordingEnabled() ? "enabled" : "disabled");
    }

    // ── Sessions ──────────────────────────────────────────────────────────

    /**
     * Launches {@code count} sessions. A session that fails to start, or to
     * reach its initial location, is logged and left out; the others get
     * contiguous indices continuing after any sessions already held.
     *
     * @param initialLocations one location per session (null or blank entries
     *                         mean none), or null for no initial navigation
     * @return the sessions created by this call
     * @throws IllegalArgumentException if {@code count < 1} or the location list size differs from {@code count}
     */
    public List<ManagedSession> createSessions(int count, BrowserKind kind, boolean headless,
                                               List<String> initialLocations) {
        checkOpen();
        if (count < 1) {
            throw new IllegalArgumentException("Session count must be at least 1, got " + count);
        }
        if (initialLocations != null && initialLocations.size() != count) {
            throw new IllegalArgumentException("Got " + initialLocations.size()
                    + " initial location(s) for " + count + " session(s)");
        }

        log.info("Creating {} {} session(s){}", count, kind, headless ? " (headless)" : "");
        List<ManagedSession> created = new ArrayList<>();
        int offset = config.getTileOffsetPx();

        for (int i = 0; i < count; i++) {
            int index = sessions.size();
            String location = initialLocations != null ? initialLocations.get(i) : null;
            SessionHandle handle = null;
            try {
                handle = factory.create(index, kind, headless);
                handle.position(i * offset, i * offset);
                if (!SessionRecord.isBlankLocation(location)) {
                    try {
                        handle.navigate(location);
                    } catch (RuntimeException e) {
                        throw new SessionCreationException(index, "cannot open initial location " + location, e);
                    }
                }
            } catch (RuntimeException e) {
                log.error("Failed to create session {} of {}: {}", i + 1, count, e.getMessage(), e);
                closeQuietly(handle, index);
                continue;
            }

            ManagedSession session = new ManagedSession(index, handle, new SessionRecord(index, location));
            sessions.add(session);
            created.add(session);
            log.info("Session {} ready ({})", index, session.getRecord().getInitialLocation());
        }

        log.info("{} of {} session(s) created", created.size(), count);
        return created;
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public List<ManagedSession> getSessions() {
        return Collections.unmodifiableList(sessions);
    }

    /** @throws IllegalArgumentException if no session has {@code index} */
    public SessionHandle sessionHandle(int index) {
        return session(index).getHandle();
    }

    public String getRunId() { return runId; }

    public FleetConfig getConfig() { return config; }

    // ── Tasks ─────────────────────────────────────────────────────────────

    /**
     * Queues {@code task} for the session at {@code sessionIndex}.
     *
     * @throws IllegalArgumentException if the index is out of range
     */
    public void addTask(BrowserTask task, int sessionIndex) {
        checkOpen();
        if (sessionIndex < 0 || sessionIndex >= sessions.size()) {
            throw new IllegalArgumentException("Invalid session index " + sessionIndex
                    + ": " + sessions.size() + " session(s) available");
        }
        pending.add(new Submission(task, sessionIndex));
        log.debug("Queued task '{}' for session {}", task.getName(), sessionIndex);
    }

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * Runs every queued task, in parallel across sessions and in queue order
     * within a session, and waits for all of them. Successful tasks are
     * captured into their session's record. When recording is enabled the
     * recording is saved afterwards and its path is on the report.
     */
    public ExecutionReport executeAll() {
        checkOpen();
        if (pending.isEmpty()) {
            log.warn("No tasks to execute");
            return ExecutionReport.empty();
        }

        List<Submission> batch = List.copyOf(pending);
        pending.clear();

        Map<Integer, SessionHandle> handles = new LinkedHashMap<>();
        sessions.forEach(s -> handles.put(s.getIndex(), s.getHandle()));

        log.info("Executing {} task(s) across {} session(s)", batch.size(), sessions.size());
        List<TaskOutcome> outcomes = scheduler.run(batch, handles,
                (task, index) -> session(index).getRecord().capture(task));
        ExecutionReport report = new ExecutionReport(outcomes, null);
        log.info("Execution finished: {}", report);

        if (config.isRecordingEnabled()) {
            try {
                report = report.withRecording(saveRecording());
            } catch (IOException e) {
                log.error("Could not save recording for run {}: {}", runId, e.getMessage(), e);
            }
        }
        return report;
    }

    // ── Recording ─────────────────────────────────────────────────────────

    /** Immutable snapshot of every session's record, as it would be saved now. */
    public Recording captureRecording() {
        List<SessionRecord> records = sessions.stream().map(ManagedSession::getRecord).toList();
        return Recording.capture(runId, sessions.size(), records);
    }

    /**
     * Writes the current recording to {@code {recordingDir}/browser_session_{runId}.json},
     * overwriting an earlier save of this run.
     *
     * @return the file written, or null when recording is disabled
     */
    public Path saveRecording() throws IOException {
        if (!config.isRecordingEnabled()) {
            log.info("Recording is disabled, not saving");
            return null;
        }
        Recording recording = captureRecording();
        Path target = config.getRecordingDir().resolve(recording.getFileName());
        RecordingIO.write(recording, target);
        log.info("Session recorded to {} ({} task(s))", target, recording.getTaskCount());
        return target;
    }

    // ── Replay ────────────────────────────────────────────────────────────

    /**
     * Recreates the recording's sessions and runs its replayable tasks.
     * Must be called on an orchestrator that holds no sessions yet.
     *
     * @throws IllegalStateException if this orchestrator already has sessions
     */
    public ReplayReport replay(Recording recording, BrowserKind kind, boolean headless) {
        checkOpen();
        if (!sessions.isEmpty()) {
            throw new IllegalStateException("Replay needs a fresh orchestrator, this one already holds "
                    + sessions.size() + " session(s)");
        }

        int requested = recording.getSessionCount();
        log.info("Replaying run '{}' ({} session(s), {} task(s))",
                recording.getRunId(), requested, recording.getTaskCount());
        if (requested < 1) {
            log.warn("Recording '{}' has no sessions, nothing to replay", recording.getRunId());
            ReplayPlan empty = ReplayPlanner.plan(recording, 0);
            return new ReplayReport(recording.getRunId(), requested, 0, 0,
                    empty.getSkippedSteps(), empty.getSkippedSessions(), ExecutionReport.empty());
        }

        // Indices are handed out over the sessions that started, so locations
        // are opened only once the final index of every session is known.
        createSessions(requested, kind, headless, null);
        if (sessions.size() < requested) {
            log.warn("Only {} of {} session(s) could be created for replay", sessions.size(), requested);
        }

        ReplayPlan plan = ReplayPlanner.plan(recording, sessions.size());
        openRecordedLocations(recording);
        plan.toSubmissions().forEach(s -> addTask(s.task(), s.sessionIndex()));
        ExecutionReport execution = executeAll();

        ReplayReport report = new ReplayReport(recording.getRunId(), requested, sessions.size(),
                plan.getRunnableCount(), plan.getSkippedSteps(), plan.getSkippedSessions(), execution);
        log.info("Replay finished: {}", report);
        return report;
    }

    private void openRecordedLocations(Recording recording) {
        for (ManagedSession session : sessions) {
            String location = recording.session(session.getIndex())
                    .map(SessionRecord::getInitialLocation)
                    .orElse(null);
            if (SessionRecord.isBlankLocation(location)) continue;
            try {
                session.getHandle().navigate(location);
                log.info("Session {} opened recorded location {}", session.getIndex(), location);
            } catch (RuntimeException e) {
                log.error("Session {} could not open recorded location {}: {}",
                        session.getIndex(), location, e.getMessage(), e);
            }
        }
    }

    // ── Coordinate selection and periodic clicking ────────────────────────

    /**
     * Arms session {@code sessionIndex} for one coordinate pick. The picked
     * point is remembered as that session's click target and then passed on
     * to {@code callback}, which may be null.
     */
    public CompletableFuture<Optional<ViewportPoint>> armSelection(int sessionIndex, SelectionCallback callback) {
        checkOpen();
        SessionHandle handle = sessionHandle(sessionIndex);
        String windowToken = handle.currentWindowToken();
        return bridge.arm(sessionIndex, handle, (index, x, y) -> {
            pickedTargets.put(index, new ClickTarget(index, handle, windowToken, x, y));
            if (callback != null) {
                callback.onSelected(index, x, y);
            }
        }, rootToken);
    }

    public void disarmSelection(int sessionIndex) {
        bridge.disarm(sessionIndex, sessionHandle(sessionIndex));
    }

    public CoordinateBridge getBridge() { return bridge; }

    /** Targets picked so far, by session index. */
    public Map<Integer, ClickTarget> getPickedTargets() {
        return Map.copyOf(pickedTargets);
    }

    /**
     * Starts clicking every picked target once per {@code interval}.
     *
     * @throws IllegalStateException if nothing was picked yet
     */
    public void startClicking(Duration interval) {
        if (pickedTargets.isEmpty()) {
            throw new IllegalStateException("No click targets selected");
        }
        List<ClickTarget> targets = new ArrayList<>(pickedTargets.values());
        targets.sort((a, b) -> Integer.compare(a.sessionIndex(), b.sessionIndex()));
        startClicking(targets, interval);
    }

    public void startClicking(List<ClickTarget> targets, Duration interval) {
        checkOpen();
        clickScheduler.start(targets, interval, rootToken);
    }

    /** Stops the click loop. Never throws. */
    public ClickLoopStatus stopClicking() {
        return clickScheduler.stop();
    }

    public PeriodicClickScheduler getClickScheduler() { return clickScheduler; }

    // ── Shutdown ──────────────────────────────────────────────────────────

    /**
     * Stops selection polls and the click loop, then closes every session.
     * A session that fails to close is logged and the rest are still closed.
     * Calling it again does nothing.
     */
    public void closeAll() {
        if (closed) return;
        closed = true;

        log.info("Closing {} session(s)", sessions.size());
        rootToken.cancel();
        ClickLoopStatus clickStatus = clickScheduler.stop();
        log.debug("Click loop final status: {}", clickStatus);
        bridge.close();

        for (ManagedSession s : sessions) {
            closeQuietly(s.getHandle(), s.getIndex());
        }
        sessions.clear();
        pending.clear();
        pickedTargets.clear();
        log.info("All sessions closed");
    }

    @Override
    public void close() {
        closeAll();
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private ManagedSession session(int index) {
        if (index < 0 || index >= sessions.size()) {
            throw new IllegalArgumentException("Invalid session index " + index
                    + ": " + sessions.size() + " session(s) available");
        }
        return sessions.get(index);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Orchestrator is closed");
        }
    }

    private static void closeQuietly(SessionHandle handle, int index) {
        if (handle == null) return;
        try {
            handle.close();
            log.debug("Session {} closed", index);
        } catch (RuntimeException e) {
            log.error("Error closing session {}: {}", index, e.getMessage(), e);
        }
    }
}
