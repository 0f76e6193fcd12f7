package fleet.interactive;

import fleet.session.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets a human pick one viewport coordinate inside a running session.
 *
 * <p>{@link #arm} installs the capture overlay through a {@link SelectionMailbox}
 * and starts a bounded polling loop on a background thread. The first
 * selection observed is handed to the {@link SelectionCallback} exactly once,
 * then the session is disarmed. If nobody clicks within
 * {@code pollInterval * maxAttempts}, or the token is cancelled, the session
 * returns to {@link BridgeState#IDLE} without a callback.
 */
public class CoordinateBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinateBridge.class);

    private final SelectionMailbox mailbox;
    private final Duration pollInterval;
    private final int maxAttempts;
    private final ExecutorService pollers;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final Map<Integer, Arming> armed = new ConcurrentHashMap<>();

    /**
     * @param mailbox      page-side slot implementation
     * @param pollInterval period between polls
     * @param maxAttempts  polls before giving up
     */
    public CoordinateBridge(SelectionMailbox mailbox, Duration pollInterval, int maxAttempts) {
        this.mailbox      = mailbox;
        this.pollInterval = pollInterval;
        this.maxAttempts  = maxAttempts;
        this.pollers      = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "coordinate-poll-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Arms {@code sessionIndex} for a single coordinate selection. Re-arming an
     * already armed session stops the earlier poll first.
     *
     * @param sessionIndex index reported to the callback
     * @param handle       the session's handle; its active window receives the overlay
     * @param callback     invoked once, on the polling thread, with the picked point
     * @param parent       cancelling it stops the poll early
     * @return completes with the point, or empty when nothing was selected
     * @throws fleet.session.SessionUnreachableException if the overlay cannot be installed
     */
    public CompletableFuture<Optional<ViewportPoint>> arm(int sessionIndex, SessionHandle handle,
                                                         SelectionCallback callback,
                                                         CancellationToken parent) {
        Arming previous = armed.remove(sessionIndex);
        if (previous != null) {
            log.info("Session {} re-armed, stopping earlier selection poll", sessionIndex);
            previous.stopAndWait(pollInterval.multipliedBy(2));
        }
        mailbox.remove(handle);

        mailbox.install(handle, sessionIndex);
        Arming arming = new Arming(sessionIndex, handle, callback, parent.child());
        armed.put(sessionIndex, arming);
        arming.state.set(BridgeState.ARMED);
        log.info("Session {} armed for coordinate selection (up to {} polls every {}ms)",
                sessionIndex, maxAttempts, pollInterval.toMillis());
        pollers.execute(arming::poll);
        return arming.result;
    }

    /**
     * Stops any poll for {@code sessionIndex} and removes leftover overlay
     * elements. Safe to call in any state; never throws.
     */
    public void disarm(int sessionIndex, SessionHandle handle) {
        Arming current = armed.remove(sessionIndex);
        if (current != null) {
            current.stopAndWait(pollInterval.multipliedBy(2));
        }
        mailbox.remove(handle);
    }

    /** Current selection state of {@code sessionIndex}. */
    public BridgeState state(int sessionIndex) {
        Arming a = armed.get(sessionIndex);
        return a == null ? BridgeState.IDLE : a.state.get();
    }

    /** Cancels every running poll and stops the polling threads. */
    @Override
    public void close() {
        armed.values().forEach(a -> a.token.cancel());
        pollers.shutdown();
        try {
            if (!pollers.awaitTermination(pollInterval.toMillis() * 2 + 500, TimeUnit.MILLISECONDS)) {
                log.warn("Coordinate polls did not stop in time, interrupting");
                pollers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pollers.shutdownNow();
        }
        armed.clear();
    }

    // ── One armed session ─────────────────────────────────────────────────

    private final class Arming {
        final int sessionIndex;
        final SessionHandle handle;
        final SelectionCallback callback;
        final CancellationToken token;
        final AtomicReference<BridgeState> state = new AtomicReference<>(BridgeState.IDLE);
        final CompletableFuture<Optional<ViewportPoint>> result = new CompletableFuture<>();

        Arming(int sessionIndex, SessionHandle handle, SelectionCallback callback, CancellationToken token) {
            this.sessionIndex = sessionIndex;
            this.handle       = handle;
            this.callback     = callback;
            this.token        = token;
        }

        void poll() {
            ViewportPoint picked = null;
            try {
                for (int attempt = 0; attempt < maxAttempts && !token.isCancelled(); attempt++) {
                    Optional<ViewportPoint> point = mailbox.take(handle);
                    if (point.isPresent()) {
                        picked = point.get();
                        break;
                    }
                    if (token.await(pollInterval)) {
                        break;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.warn("Session {}: coordinate polling stopped: {}", sessionIndex, e.getMessage());
            }

            if (picked != null && !token.isCancelled()) {
                state.set(BridgeState.SELECTED);
                log.info("Session {}: position selected at {}", sessionIndex, picked);
                try {
                    callback.onSelected(sessionIndex, picked.x(), picked.y());
                } catch (RuntimeException e) {
                    log.error("Session {}: selection callback failed: {}", sessionIndex, e.getMessage(), e);
                }
            } else {
                picked = null;
                log.info("Session {}: no position selected", sessionIndex);
            }

            // a superseded arming must not tear down its successor's overlay
            if (armed.remove(sessionIndex, this)) {
                mailbox.remove(handle);
            }
            state.set(BridgeState.IDLE);
            token.release();
            result.complete(Optional.ofNullable(picked));
        }

        void stopAndWait(Duration grace) {
            token.cancel();
            try {
                result.get(grace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Session {}: earlier selection poll did not stop cleanly: {}", sessionIndex, e.getMessage());
            }
        }
    }
}
