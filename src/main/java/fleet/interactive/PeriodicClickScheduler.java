package fleet.interactive;

import fleet.session.SessionHandle;
import fleet.session.SessionUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Repeatedly clicks every active {@link ClickTarget} at its stored coordinate,
 * once per tick, until stopped or until the loop has counted {@code maxErrors}
 * errors.
 *
 * <p>Ticks run at a fixed rate on a single daemon thread. Before each click
 * the target's session is brought back to the window the coordinate was
 * picked in. A target whose window no longer exists is skipped for that tick
 * and counted as an error.
 *
 * <p>Stopping is cooperative: the loop checks its token before every click.
 * A click already in flight finishes.
 */
public class PeriodicClickScheduler {

    private static final Logger log = LoggerFactory.getLogger(PeriodicClickScheduler.class);

    private final CoordinateClicker clicker;
    private final int maxErrors;
    private final Duration stopGrace;

    private final Set<Integer> inactive = ConcurrentHashMap.newKeySet();
    private final Map<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final Map<Integer, AtomicInteger> clicks = new ConcurrentHashMap<>();
    private final AtomicInteger ticks = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
    private final AtomicReference<ClickLoopStatus.State> state =
            new AtomicReference<>(ClickLoopStatus.State.IDLE);

    private volatile String lastError;
    private CancellationToken token;
    private ScheduledExecutorService executor;

    /**
     * @param clicker   performs the individual clicks
     * @param maxErrors errors after which the loop stops itself
     * @param stopGrace how long {@link #stop()} waits for the loop to finish
     */
    public PeriodicClickScheduler(CoordinateClicker clicker, int maxErrors, Duration stopGrace) {
        this.clicker   = clicker;
        this.maxErrors = maxErrors;
        this.stopGrace = stopGrace;
    }

    /**
     * Starts clicking. The first tick runs immediately.
     *
     * @param targets  pairs to click, in order, every tick
     * @param interval pause between tick starts
     * @param parent   cancelling it stops the loop
     * @throws IllegalStateException    if the loop is already running
     * @throws IllegalArgumentException if {@code targets} is empty or the interval is not positive
     */
    public synchronized void start(List<ClickTarget> targets, Duration interval, CancellationToken parent) {
        if (state.get() == ClickLoopStatus.State.RUNNING) {
            throw new IllegalStateException("Periodic clicking is already running");
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("At least one click target is required");
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Click interval must be positive, got " + interval);
        }

        List<ClickTarget> snapshot = List.copyOf(targets);
        attempts.clear();
        clicks.clear();
        ticks.set(0);
        errors.set(0);
        lastError = null;
        snapshot.forEach(t -> {
            attempts.put(t.sessionIndex(), new AtomicInteger());
            clicks.put(t.sessionIndex(), new AtomicInteger());
        });

        ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-clicker");
            t.setDaemon(true);
            return t;
        });
        CancellationToken loopToken = parent.child();
        executor = loop;
        token = loopToken;
        state.set(ClickLoopStatus.State.RUNNING);

        loop.scheduleAtFixedRate(() -> tick(snapshot, loopToken), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        loopToken.onCancel(() -> finish(loop));
        log.info("Clicking {} target(s) every {}ms (error budget {})",
                snapshot.size(), interval.toMillis(), maxErrors);
    }

    /**
     * Signals the loop to stop and waits up to the grace period for it.
     * Never throws.
     *
     * @return the final status
     */
    public ClickLoopStatus stop() {
        CancellationToken running;
        ScheduledExecutorService loop;
        synchronized (this) {
            running = token;
            loop = executor;
        }
        if (running != null) {
            running.cancel();
        }
        if (loop != null) {
            try {
                if (!loop.awaitTermination(stopGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Periodic clicker did not stop within {}ms", stopGrace.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return status();
    }

    /**
     * Waits until the loop ends by itself or {@code timeout} elapses.
     *
     * @return the status at return time
     */
    public ClickLoopStatus awaitTermination(Duration timeout) throws InterruptedException {
        ScheduledExecutorService loop;
        synchronized (this) {
            loop = executor;
        }
        if (loop != null) {
            loop.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return status();
    }

    /**
     * Enables or disables clicking for one session without stopping the loop.
     * A disabled session stays disabled until enabled again or until the
     * current run ends.
     */
    public void setActive(int sessionIndex, boolean active) {
        if (active) {
            inactive.remove(sessionIndex);
        } else {
            inactive.add(sessionIndex);
        }
    }

    public boolean isRunning() {
        return state.get() == ClickLoopStatus.State.RUNNING;
    }

    public ClickLoopStatus status() {
        Map<Integer, Integer> a = new TreeMap<>();
        Map<Integer, Integer> c = new TreeMap<>();
        attempts.forEach((k, v) -> a.put(k, v.get()));
        clicks.forEach((k, v) -> c.put(k, v.get()));
        return new ClickLoopStatus(state.get(), ticks.get(), a, c, errors.get(), lastError);
    }

    // ── Loop ──────────────────────────────────────────────────────────────

    private void tick(List<ClickTarget> targets, CancellationToken loopToken) {
        for (ClickTarget target : targets) {
            if (loopToken.isCancelled()) return;
            if (inactive.contains(target.sessionIndex())) continue;

            attempts.get(target.sessionIndex()).incrementAndGet();
            try {
                ensureWindow(target);
                clicker.clickAt(target.handle(), target.x(), target.y());
                clicks.get(target.sessionIndex()).incrementAndGet();
            } catch (RuntimeException e) {
                int count = errors.incrementAndGet();
                lastError = "Session " + target.sessionIndex() + ": " + e.getMessage();
                log.error("Error clicking in session {} ({}/{}): {}",
                        target.sessionIndex(), count, maxErrors, e.getMessage());
                if (count >= maxErrors) {
                    state.compareAndSet(ClickLoopStatus.State.RUNNING, ClickLoopStatus.State.ERROR_BUDGET_EXHAUSTED);
                    log.error("Too many errors ({}), stopping periodic clicking", count);
                    loopToken.cancel();
                    return;
                }
            }
        }
        int done = ticks.incrementAndGet();
        log.debug("Click tick {} complete", done);
    }

    private void finish(ScheduledExecutorService loop) {
        state.compareAndSet(ClickLoopStatus.State.RUNNING, ClickLoopStatus.State.STOPPED);
        loop.shutdown();
        inactive.clear();
        log.info("Periodic clicking ended: {} tick(s), {} error(s), state={}", ticks.get(), errors.get(), state.get());
    }

    private static void ensureWindow(ClickTarget target) {
        SessionHandle handle = target.handle();
        Set<String> windows = handle.windowTokens();
        if (!windows.contains(target.windowToken())) {
            throw new SessionUnreachableException("window '" + target.windowToken() + "' is no longer open");
        }
        if (!target.windowToken().equals(handle.currentWindowToken())) {
            handle.focus(target.windowToken());
        }
    }
}
