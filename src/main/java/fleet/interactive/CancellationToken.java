package fleet.interactive;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal passed into every polling and clicking loop.
 *
 * <p>Loops check {@link #isCancelled()} at their suspension points and sleep
 * through {@link #await(Duration)}, which returns early once the token is
 * cancelled. Cancelling a token also cancels every token created with
 * {@link #child()}.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final CancellationToken parent;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        latch.countDown();
        children.forEach(CancellationToken::cancel);
        listeners.forEach(Runnable::run);
        release();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for up to {@code timeout}, waking early on cancellation.
     *
     * @return true if the token is cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** A token that is cancelled together with this one (or on its own). */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(this);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Runs {@code action} once when this token is cancelled, on the cancelling
     * thread. Runs it immediately if the token is already cancelled.
     */
    public void onCancel(Runnable action) {
        AtomicBoolean ran = new AtomicBoolean();
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) action.run();
        };
        listeners.add(once);
        if (isCancelled()) {
            once.run();
        }
    }

    /**
     * Detaches this token from its parent. Loops call it when they finish so a
     * long-lived parent only tracks the children still in use.
     */
    public void release() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    int childCount() {
        return children.size();
    }
}
