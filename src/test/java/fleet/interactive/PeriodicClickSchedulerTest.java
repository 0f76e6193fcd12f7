package fleet.interactive;

import fleet.session.SessionHandle;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Timing and error-budget tests for {@link PeriodicClickScheduler}. The
 * clicker and sessions are mocks, so only the loop itself is exercised.
 */
public class PeriodicClickSchedulerTest {

    @Mock private CoordinateClicker clicker;
    @Mock private SessionHandle first;
    @Mock private SessionHandle second;

    private AutoCloseable mocks;
    private PeriodicClickScheduler scheduler;
    private CancellationToken root;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        for (SessionHandle h : List.of(first, second)) {
            when(h.windowTokens()).thenReturn(Set.of("main"));
            when(h.currentWindowToken()).thenReturn("main");
        }
        scheduler = new PeriodicClickScheduler(clicker, 5, Duration.ofSeconds(1));
        root = new CancellationToken();
    }

    @AfterMethod
    public void tearDown() throws Exception {
        scheduler.stop();
        mocks.close();
    }

    @Test(description = "Two targets at 100ms for 350ms get three or four attempts each", timeOut = 10_000)
    public void testTickCadence() throws Exception {
        when(clicker.clickAt(any(), anyLong(), anyLong())).thenReturn(true);
        scheduler.start(List.of(
                new ClickTarget(0, first, "main", 10, 20),
                new ClickTarget(1, second, "main", 30, 40)), Duration.ofMillis(100), root);

        Thread.sleep(350);
        ClickLoopStatus status = scheduler.stop();

        assertThat(status.state()).isEqualTo(ClickLoopStatus.State.STOPPED);
        assertThat(status.attemptsFor(0)).isBetween(3, 4);
        assertThat(status.attemptsFor(1)).isBetween(3, 4);
        assertThat(status.clicksFor(0)).isEqualTo(status.attemptsFor(0));
        assertThat(status.errors()).isZero();
        verify(clicker, atLeast(3)).clickAt(first, 10, 20);
        verify(clicker, atLeast(3)).clickAt(second, 30, 40);
    }

    @Test(description = "Five click errors stop the loop and stop() does not throw", timeOut = 10_000)
    public void testErrorBudget() throws Exception {
        when(clicker.clickAt(eq(first), anyLong(), anyLong())).thenThrow(new IllegalStateException("script failed"));
        when(clicker.clickAt(eq(second), anyLong(), anyLong())).thenReturn(true);
        scheduler.start(List.of(
                new ClickTarget(0, first, "main", 1, 1),
                new ClickTarget(1, second, "main", 2, 2)), Duration.ofMillis(10), root);

        ClickLoopStatus ended = scheduler.awaitTermination(Duration.ofSeconds(5));

        assertThat(ended.state()).isEqualTo(ClickLoopStatus.State.ERROR_BUDGET_EXHAUSTED);
        assertThat(ended.errors()).isEqualTo(5);
        assertThat(ended.lastError()).contains("script failed");
        assertThat(scheduler.isRunning()).isFalse();
        assertThatCode(() -> scheduler.stop()).doesNotThrowAnyException();
        assertThat(scheduler.stop().state()).isEqualTo(ClickLoopStatus.State.ERROR_BUDGET_EXHAUSTED);
    }

    @Test(description = "A target whose window was closed is skipped and counted as an error", timeOut = 10_000)
    public void testStaleWindow() throws Exception {
        when(first.windowTokens()).thenReturn(Set.of("popup"));
        scheduler.start(List.of(new ClickTarget(0, first, "main", 1, 1)), Duration.ofMillis(10), root);

        ClickLoopStatus ended = scheduler.awaitTermination(Duration.ofSeconds(5));

        assertThat(ended.state()).isEqualTo(ClickLoopStatus.State.ERROR_BUDGET_EXHAUSTED);
        assertThat(ended.clicksFor(0)).isZero();
        verify(clicker, never()).clickAt(any(), anyLong(), anyLong());
    }

    @Test(description = "The captured window is focused again before clicking", timeOut = 10_000)
    public void testRefocusesWindow() throws Exception {
        when(first.windowTokens()).thenReturn(Set.of("main", "popup"));
        when(first.currentWindowToken()).thenReturn("popup");
        scheduler.start(List.of(new ClickTarget(0, first, "main", 1, 1)), Duration.ofMillis(50), root);

        Thread.sleep(80);
        scheduler.stop();

        verify(first, atLeastOnce()).focus("main");
        verify(clicker, atLeastOnce()).clickAt(first, 1, 1);
    }

    @Test(description = "An inactive target is not clicked", timeOut = 10_000)
    public void testSetActive() throws Exception {
        scheduler.setActive(1, false);
        scheduler.start(List.of(
                new ClickTarget(0, first, "main", 1, 1),
                new ClickTarget(1, second, "main", 2, 2)), Duration.ofMillis(20), root);

        Thread.sleep(70);
        ClickLoopStatus status = scheduler.stop();

        assertThat(status.attemptsFor(0)).isPositive();
        assertThat(status.attemptsFor(1)).isZero();
        verify(clicker, never()).clickAt(eq(second), anyLong(), anyLong());
    }

    @Test(description = "A target disabled in one run is clicked again in the next", timeOut = 10_000)
    public void testInactiveResetBetweenRuns() throws Exception {
        List<ClickTarget> targets = List.of(
                new ClickTarget(0, first, "main", 1, 1),
                new ClickTarget(1, second, "main", 2, 2));
        scheduler.setActive(1, false);
        scheduler.start(targets, Duration.ofMillis(20), root);
        Thread.sleep(50);
        assertThat(scheduler.stop().attemptsFor(1)).isZero();

        scheduler.start(targets, Duration.ofMillis(20), root);
        Thread.sleep(50);
        ClickLoopStatus rerun = scheduler.stop();

        assertThat(rerun.attemptsFor(1)).isPositive();
        assertThat(root.childCount()).isZero();
    }

    @Test(description = "Cancelling the parent token stops the loop", timeOut = 10_000)
    public void testParentCancellation() throws Exception {
        scheduler.start(List.of(new ClickTarget(0, first, "main", 1, 1)), Duration.ofSeconds(10), root);

        root.cancel();
        ClickLoopStatus ended = scheduler.awaitTermination(Duration.ofSeconds(5));

        assertThat(ended.state()).isEqualTo(ClickLoopStatus.State.STOPPED);
    }

    @Test(description = "Starting twice or without targets is rejected")
    public void testInvalidStarts() {
        assertThatThrownBy(() -> scheduler.start(List.of(), Duration.ofMillis(10), root))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.start(List.of(new ClickTarget(0, first, "main", 1, 1)),
                Duration.ZERO, root)).isInstanceOf(IllegalArgumentException.class);

        scheduler.start(List.of(new ClickTarget(0, first, "main", 1, 1)), Duration.ofSeconds(10), root);
        assertThatThrownBy(() -> scheduler.start(List.of(new ClickTarget(0, first, "main", 1, 1)),
                Duration.ofSeconds(10), root)).isInstanceOf(IllegalStateException.class);
    }

    @Test(description = "stop() before start reports an idle loop")
    public void testStopBeforeStart() {
        assertThat(scheduler.stop().state()).isEqualTo(ClickLoopStatus.State.IDLE);
    }
}
