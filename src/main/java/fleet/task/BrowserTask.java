package fleet.task;

import fleet.session.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named unit of work bound to one session.
 *
 * <p>Identity fields ({@code name}, {@code actionKind}, {@code description},
 * {@code args}, {@code kwargs}) are fixed at construction. Outcome fields are
 * written once, by {@link #execute(SessionHandle)}; a task cannot be executed
 * twice.
 *
 * <p>Parameters may hold anything the action understands, including values
 * that cannot be serialized. Those are filtered out only when the task is
 * captured into a session record, never before execution.
 */
public class BrowserTask {

    private static final Logger log = LoggerFactory.getLogger(BrowserTask.class);

    private final String name;
    private final ActionKind actionKind;
    private final String description;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final TaskAction action;

    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile Object result;
    private volatile Throwable error;
    private volatile boolean completed;

    /**
     * @param name        identifier used in logs and recordings
     * @param actionKind  kind used when the task is recorded and replayed
     * @param description human-readable description; defaults to {@code name} when null
     * @param args        positional parameters (may contain nulls)
     * @param kwargs      named parameters
     * @param action      the body to run
     */
    public BrowserTask(String name, ActionKind actionKind, String description,
                       List<?> args, Map<String, ?> kwargs, TaskAction action) {
        this.name        = Objects.requireNonNull(name, "name");
        this.actionKind  = actionKind != null ? actionKind : ActionKind.CUSTOM;
        this.description = description != null ? description : name;
        this.args        = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
        this.kwargs      = kwargs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)) : Map.of();
        this.action      = Objects.requireNonNull(action, "action");
    }

    /** Convenience constructor for a custom task without parameters. */
    public BrowserTask(String name, String description, TaskAction action) {
        this(name, ActionKind.CUSTOM, description, List.of(), Map.of(), action);
    }

    // ── Execution ─────────────────────────────────────────────────────────

    /**
     * Runs the bound action against {@code session}, recording start/end time
     * and either the result or the error. Failures are rethrown to the caller.
     *
     * @return the action's result
     * @throws IllegalStateException  if the task was already executed
     * @throws TaskExecutionException if the action threw a checked exception
     * @throws RuntimeException       any unchecked exception thrown by the action
     */
    public Object execute(SessionHandle session) {
        synchronized (this) {
            if (startedAt != null) {
                throw new IllegalStateException("Task '" + name + "' has already been executed");
            }
            startedAt = Instant.now();
        }
        try {
            Object value = action.run(session, args, kwargs);
            result    = value;
            endedAt   = Instant.now();
            completed = true;
            log.info("Task '{}' completed in {}s", name, String.format("%.2f", elapsedSeconds()));
            return value;
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
            throw new TaskExecutionException(name, e);
        } catch (Exception e) {
            fail(e);
            throw new TaskExecutionException(name, e);
        }
    }

    private void fail(Throwable e) {
        error   = e;
        endedAt = Instant.now();
        log.error("Error executing task '{}': {}", name, e.getMessage());
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String              getName()        { return name; }
    public ActionKind          getActionKind()  { return actionKind; }
    public String              getDescription() { return description; }
    public List<Object>        getArgs()        { return args; }
    public Map<String, Object> getKwargs()      { return kwargs; }
    public Instant             getStartedAt()   { return startedAt; }
    public Instant             getEndedAt()     { return endedAt; }
    public Object              getResult()      { return result; }
    public Throwable           getError()       { return error; }
    public boolean             isCompleted()    { return completed; }

    /** Wall-clock run time, or null when the task has not finished. */
    public Duration getElapsed() {
        Instant start = startedAt;
        Instant end   = endedAt;
        return (start == null || end == null) ? null : Duration.between(start, end);
    }

    private double elapsedSeconds() {
        Duration d = getElapsed();
        return d == null ? 0.0 : d.toNanos() / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("BrowserTask{name='%s', kind=%s, completed=%b}", name, actionKind, completed);
    }
}
