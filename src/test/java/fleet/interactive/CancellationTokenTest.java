package fleet.interactive;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class CancellationTokenTest {

    @Test(description = "Cancelling a parent cancels its children")
    public void testCascade() {
        CancellationToken parent = new CancellationToken();
        CancellationToken child = parent.child();
        CancellationToken grandChild = child.child();

        parent.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandChild.isCancelled()).isTrue();
    }

    @Test(description = "Cancelling a child leaves the parent running")
    public void testChildIndependent() {
        CancellationToken parent = new CancellationToken();
        parent.child().cancel();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test(description = "A child of a cancelled token starts cancelled")
    public void testChildOfCancelled() {
        CancellationToken parent = new CancellationToken();
        parent.cancel();
        assertThat(parent.child().isCancelled()).isTrue();
    }

    @Test(description = "await wakes early on cancel", timeOut = 5_000)
    public void testAwait() throws InterruptedException {
        CancellationToken token = new CancellationToken();
        assertThat(token.await(Duration.ofMillis(20))).isFalse();

        new Thread(token::cancel).start();
        assertThat(token.await(Duration.ofSeconds(4))).isTrue();
    }

    @Test(description = "Cancelled and released children are no longer tracked by the parent")
    public void testChildrenDetach() {
        CancellationToken parent = new CancellationToken();
        CancellationToken cancelled = parent.child();
        CancellationToken finished = parent.child();
        parent.child();

        cancelled.cancel();
        finished.release();

        assertThat(parent.childCount()).isEqualTo(1);
        assertThat(finished.isCancelled()).isFalse();
    }

    @Test(description = "Cancel listeners run once, including ones added after cancel")
    public void testOnCancel() {
        CancellationToken parent = new CancellationToken();
        CancellationToken child = parent.child();
        AtomicInteger runs = new AtomicInteger();
        child.onCancel(runs::incrementAndGet);

        parent.cancel();
        child.cancel();
        child.onCancel(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(2);
    }
}
