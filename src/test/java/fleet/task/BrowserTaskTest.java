package fleet.task;

import fleet.session.SessionHandle;
import org.testng.annotations.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link BrowserTask}.
 */
public class BrowserTaskTest {

    private final SessionHandle session = mock(SessionHandle.class);

    @Test(description = "A successful run stores the result and both timestamps")
    public void testSuccessfulExecution() {
        BrowserTask task = new BrowserTask("answer", "returns 42", (s, args, kwargs) -> 42);

        Object result = task.execute(session);

        assertThat(result).isEqualTo(42);
        assertThat(task.isCompleted()).isTrue();
        assertThat(task.getResult()).isEqualTo(42);
        assertThat(task.getError()).isNull();
        assertThat(task.getStartedAt()).isNotNull();
        assertThat(task.getEndedAt()).isAfterOrEqualTo(task.getStartedAt());
        assertThat(task.getElapsed()).isGreaterThanOrEqualTo(Duration.ZERO);
    }

    @Test(description = "A runtime failure is stored and rethrown unchanged")
    public void testRuntimeFailureRethrown() {
        IllegalStateException boom = new IllegalStateException("boom");
        BrowserTask task = new BrowserTask("fails", null, (s, args, kwargs) -> { throw boom; });

        assertThatThrownBy(() -> task.execute(session)).isSameAs(boom);
        assertThat(task.isCompleted()).isFalse();
        assertThat(task.getError()).isSameAs(boom);
        assertThat(task.getEndedAt()).isNotNull();
    }

    @Test(description = "A checked failure is wrapped in TaskExecutionException")
    public void testCheckedFailureWrapped() {
        BrowserTask task = new BrowserTask("io", null, (s, args, kwargs) -> { throw new IOException("disk"); });

        assertThatThrownBy(() -> task.execute(session))
                .isInstanceOf(TaskExecutionException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("io");
        assertThat(task.getError()).isInstanceOf(IOException.class);
    }

    @Test(description = "A task cannot be executed twice")
    public void testSecondExecutionRejected() {
        BrowserTask task = new BrowserTask("once", null, (s, args, kwargs) -> null);
        task.execute(session);

        assertThatThrownBy(() -> task.execute(session)).isInstanceOf(IllegalStateException.class);
    }

    @Test(description = "Description defaults to the name and parameters are passed through")
    public void testDefaultsAndParameters() {
        Object[] seen = new Object[2];
        BrowserTask task = new BrowserTask("params", ActionKind.CLICK, null,
                List.of("#go"), Map.of("timeout", 3), (s, args, kwargs) -> {
                    seen[0] = args;
                    seen[1] = kwargs;
                    return null;
                });

        task.execute(session);

        assertThat(task.getDescription()).isEqualTo("params");
        assertThat(task.getActionKind()).isEqualTo(ActionKind.CLICK);
        assertThat(seen[0]).isEqualTo(List.of("#go"));
        assertThat(seen[1]).isEqualTo(Map.of("timeout", 3));
    }

    @Test(description = "Elapsed is null before the task ran")
    public void testElapsedBeforeRun() {
        BrowserTask task = new BrowserTask("idle", null, (s, args, kwargs) -> null);
        assertThat(task.getElapsed()).isNull();
        assertThat(task.isCompleted()).isFalse();
    }
}
