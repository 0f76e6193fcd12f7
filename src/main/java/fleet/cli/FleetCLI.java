package fleet.cli;

import fleet.interactive.ClickLoopStatus;
import fleet.interactive.ViewportPoint;
import fleet.model.Recording;
import fleet.model.RecordingIO;
import fleet.model.RecordingNotFoundException;
import fleet.orchestrator.ExecutionReport;
import fleet.orchestrator.FleetConfig;
import fleet.orchestrator.FleetOrchestrator;
import fleet.orchestrator.ManagedSession;
import fleet.orchestrator.TaskOutcome;
import fleet.replay.RecordingLocator;
import fleet.replay.ReplayReport;
import fleet.replay.ReplayStep;
import fleet.session.BrowserKind;
import fleet.session.SeleniumSessionFactory;
import fleet.session.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line entry point for Browser Fleet.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code fleet run}    - runs the demo scenario across several sessions</li>
 *   <li>{@code fleet replay} - replays a saved recording</li>
 *   <li>{@code fleet list}   - lists saved recordings, newest first</li>
 *   <li>{@code fleet pick}   - picks one point per session, then clicks them periodically</li>
 * </ul>
 */
@Command(
        name        = "fleet",
        description = "Drive several browser sessions in parallel, record and replay them",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                FleetCLI.RunCommand.class,
                FleetCLI.ReplayCommand.class,
                FleetCLI.ListCommand.class,
                FleetCLI.PickCommand.class
        }
)
public class FleetCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new FleetCLI()).execute(args);
        System.exit(exit);
    }

    static SessionFactory sessionFactory(FleetConfig config) {
        return new SeleniumSessionFactory(config.getWindowWidth(), config.getWindowHeight(),
                config.getPageLoadTimeout());
    }

    static void printReport(ExecutionReport report) {
        System.out.printf("%nTasks: %d succeeded, %d failed, %d skipped%n",
                report.count(TaskOutcome.Status.SUCCEEDED),
                report.count(TaskOutcome.Status.FAILED),
                report.count(TaskOutcome.Status.SKIPPED));
        for (TaskOutcome failure : report.getFailures()) {
            System.out.printf("  FAILED  session %d  %-30s %s%n",
                    failure.sessionIndex(), failure.taskName(), failure.error());
        }
        if (report.getRecordingPath() != null) {
            System.out.println("Recording saved: " + report.getRecordingPath().toAbsolutePath());
        }
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Launches the sessions and runs the demo tasks, optionally replaying the
     * saved recording right after.
     */
    @Command(
            name        = "run",
            description = "Run the example scenario across several browser sessions",
            mixinStandardHelpOptions = true
    )
    static class RunCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

        @Option(names = {"-n", "--browsers"}, description = "Number of sessions (default: 3)", defaultValue = "3")
        int browsers;

        @Option(names = {"-b", "--browser"}, description = "Browser: chrome, edge, firefox (default: chrome)",
                defaultValue = "chrome")
        String browser;

        @Option(names = "--headless", description = "Run without visible windows")
        boolean headless;

        @Option(names = "--no-record", description = "Do not save a recording")
        boolean noRecord;

        @Option(names = {"-d", "--recording-dir"}, description = "Recordings directory (default from config)")
        String recordingDir;

        @Option(names = "--auto-replay", description = "Replay the saved recording once the run finishes")
        boolean autoReplay;

        @Override
        public Integer call() throws Exception {
            FleetConfig config = new FleetConfig();
            if (noRecord) config.setRecordingEnabled(false);
            if (recordingDir != null) config.setRecordingDir(recordingDir);
            BrowserKind kind = BrowserKind.parse(browser);

            ExecutionReport report;
            try (FleetOrchestrator fleet = new FleetOrchestrator(sessionFactory(config), config)) {
                List<ManagedSession> sessions = fleet.createSessions(browsers, kind, headless,
                        ExampleScenario.startPages(browsers));
                if (sessions.isEmpty()) {
                    System.err.println("No browser session could be started");
                    return 1;
                }
                System.out.printf("Created %d of %d session(s)%n", sessions.size(), browsers);

                ExampleScenario.tasks(sessions.size()).forEach(s -> fleet.addTask(s.task(), s.sessionIndex()));
                report = fleet.executeAll();
            }
            printReport(report);

            if (autoReplay) {
                if (report.getRecordingPath() == null) {
                    System.out.println("Nothing to replay: no recording was saved");
                } else {
                    log.info("Auto-replaying {}", report.getRecordingPath());
                    ReplayReport replay = ReplayCommand.replay(report.getRecordingPath(), kind, headless);
                    ReplayCommand.printReplay(replay);
                }
            }
            return report.isAllSucceeded() ? 0 : 2;
        }
    }

    /**
     * Loads a recording by path or run id and replays it in fresh sessions.
     */
    @Command(
            name        = "replay",
            description = "Replay a saved recording (path, file name or run id)",
            mixinStandardHelpOptions = true
    )
    static class ReplayCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ReplayCommand.class);

        @Parameters(index = "0", description = "Recording path, file name or run id")
        String ref;

        @Option(names = {"-b", "--browser"}, description = "Browser: chrome, edge, firefox (default: chrome)",
                defaultValue = "chrome")
        String browser;

        @Option(names = "--headless", description = "Run without visible windows")
        boolean headless;

        @Option(names = {"-d", "--recording-dir"}, description = "Recordings directory (default from config)")
        String recordingDir;

        @Override
        public Integer call() throws Exception {
            FleetConfig config = new FleetConfig();
            if (recordingDir != null) config.setRecordingDir(recordingDir);

            Path file;
            try {
                file = new RecordingLocator(config.getRecordingDir()).resolve(ref);
            } catch (RecordingNotFoundException e) {
                System.err.println(e.getMessage());
                return 1;
            }

            try {
                printReplay(replay(file, BrowserKind.parse(browser), headless));
            } catch (RecordingIO.MalformedRecordingException e) {
                log.error("Cannot replay {}: {}", file, e.getMessage());
                System.err.println("Invalid recording: " + e.getMessage());
                return 1;
            }
            return 0;
        }

        /** Loads {@code file} and replays it on a new orchestrator that does not record. */
        static ReplayReport replay(Path file, BrowserKind kind, boolean headless) throws IOException {
            Recording recording = RecordingIO.read(file);
            System.out.printf("Replaying %s: %d session(s), %d task(s)%n",
                    file.getFileName(), recording.getSessionCount(), recording.getTaskCount());

            FleetConfig config = new FleetConfig();
            config.setRecordingEnabled(false);
            try (FleetOrchestrator fleet = new FleetOrchestrator(sessionFactory(config), config)) {
                return fleet.replay(recording, kind, headless);
            }
        }

        static void printReplay(ReplayReport report) {
            System.out.printf("%nReplay of run %s: %d of %d session(s), %d task(s) submitted%n",
                    report.runId(), report.sessionsCreated(), report.sessionsRequested(), report.tasksSubmitted());
            for (ReplayStep skip : report.skippedSteps()) {
                System.out.printf("  SKIPPED session %d  %-30s %s%n",
                        skip.sessionIndex(), skip.sourceName(), skip.skipReason());
            }
            if (!report.skippedSessions().isEmpty()) {
                System.out.println("  Sessions out of range: " + report.skippedSessions());
            }
            printReport(report.execution());
        }
    }

    /**
     * Lists recordings newest first with size and modification time.
     */
    @Command(
            name        = "list",
            description = "List saved recordings, newest first",
            mixinStandardHelpOptions = true
    )
    static class ListCommand implements Callable<Integer> {

        private static final DateTimeFormatter MODIFIED_FMT =
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

        @Option(names = {"-d", "--recording-dir"}, description = "Recordings directory (default from config)")
        String recordingDir;

        @Override
        public Integer call() throws Exception {
            FleetConfig config = new FleetConfig();
            if (recordingDir != null) config.setRecordingDir(recordingDir);
            RecordingLocator locator = new RecordingLocator(config.getRecordingDir());

            List<RecordingLocator.Entry> entries = locator.list();
            if (entries.isEmpty()) {
                System.out.println("No recordings found in: " + locator.getDirectory().toAbsolutePath());
                return 0;
            }

            System.out.printf("Recordings in %s:%n", locator.getDirectory().toAbsolutePath());
            System.out.printf("%-45s %10s  %s%n", "File", "Size", "Modified");
            System.out.println("-".repeat(78));
            for (RecordingLocator.Entry e : entries) {
                System.out.printf("%-45s %7.1f KB  %s%n",
                        e.fileName(), e.sizeKb(), MODIFIED_FMT.format(e.modified()));
            }
            return 0;
        }
    }

    /**
     * Opens sessions at one URL, lets the user pick a point in each, then clicks
     * every picked point periodically until Enter is pressed or the duration ends.
     */
    @Command(
            name        = "pick",
            description = "Pick a point in each session, then click the points periodically",
            mixinStandardHelpOptions = true
    )
    static class PickCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(PickCommand.class);

        @Option(names = "--url", description = "Page to open in every session", required = true)
        String url;

        @Option(names = {"-n", "--browsers"}, description = "Number of sessions (default: 1)", defaultValue = "1")
        int browsers;

        @Option(names = {"-b", "--browser"}, description = "Browser: chrome, edge, firefox (default: chrome)",
                defaultValue = "chrome")
        String browser;

        @Option(names = "--interval-ms", description = "Click interval in milliseconds (default from config)")
        Long intervalMs;

        @Option(names = "--duration-sec", description = "Stop after this many seconds (default: wait for Enter)",
                defaultValue = "0")
        long durationSec;

        @Override
        public Integer call() throws Exception {
            FleetConfig config = new FleetConfig();
            config.setRecordingEnabled(false);
            Duration interval = intervalMs != null ? Duration.ofMillis(intervalMs) : config.getClickInterval();
            long pickBudgetMs = config.getPollInterval().toMillis() * config.getPollMaxAttempts();

            try (FleetOrchestrator fleet = new FleetOrchestrator(sessionFactory(config), config)) {
                List<ManagedSession> sessions = fleet.createSessions(browsers, BrowserKind.parse(browser), false,
                        Collections.nCopies(browsers, url));
                if (sessions.isEmpty()) {
                    System.err.println("No browser session could be started");
                    return 1;
                }

                for (ManagedSession s : sessions) {
                    System.out.printf("Click the target position in browser %d (%d s to choose)...%n",
                            s.getIndex() + 1, pickBudgetMs / 1000);
                    Optional<ViewportPoint> point = awaitPick(fleet, s.getIndex(), pickBudgetMs);
                    if (point.isPresent()) {
                        System.out.printf("  Browser %d: position (%d, %d)%n",
                                s.getIndex() + 1, point.get().x(), point.get().y());
                    } else {
                        System.out.printf("  Browser %d: no position selected%n", s.getIndex() + 1);
                    }
                }

                if (fleet.getPickedTargets().isEmpty()) {
                    System.err.println("No positions selected, nothing to click");
                    return 1;
                }

                fleet.startClicking(interval);
                if (durationSec > 0) {
                    System.out.printf("Clicking every %d ms for %d s...%n", interval.toMillis(), durationSec);
                    fleet.getClickScheduler().awaitTermination(Duration.ofSeconds(durationSec));
                } else {
                    System.out.printf("Clicking every %d ms, press Enter to stop...%n", interval.toMillis());
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
                }

                ClickLoopStatus status = fleet.stopClicking();
                System.out.printf("Stopped (%s): %d tick(s), %d error(s)%n",
                        status.state(), status.ticks(), status.errors());
                status.clicks().forEach((index, clicks) ->
                        System.out.printf("  Browser %d: %d click(s)%n", index + 1, clicks));
                return status.state() == ClickLoopStatus.State.ERROR_BUDGET_EXHAUSTED ? 2 : 0;
            }
        }

        private static Optional<ViewportPoint> awaitPick(FleetOrchestrator fleet, int index, long budgetMs)
                throws InterruptedException {
            try {
                return fleet.armSelection(index, null).get(budgetMs + 2000, TimeUnit.MILLISECONDS);
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Session {}: position selection did not finish: {}", index, e.getMessage());
                fleet.disarmSelection(index);
                return Optional.empty();
            }
        }
    }
}
