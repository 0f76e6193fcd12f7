package fleet.interactive;

import fleet.session.SessionHandle;
import fleet.session.SessionUnreachableException;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class CoordinateClickerTest {

    private final CoordinateClicker clicker = new CoordinateClicker();

    @Test(description = "The page script handles the click when an element is at the point")
    public void testScriptHit() {
        SessionHandle handle = mock(SessionHandle.class);
        when(handle.runScript(CoordinateClicker.CLICK_SCRIPT, 120L, 240L)).thenReturn(true);

        assertThat(clicker.clickAt(handle, 120, 240)).isTrue();
        verify(handle, never()).pointerClick(anyLong(), anyLong());
    }

    @Test(description = "With no element at the point a pointer click is used")
    public void testPointerFallback() {
        SessionHandle handle = mock(SessionHandle.class);
        when(handle.runScript(CoordinateClicker.CLICK_SCRIPT, 5L, 6L)).thenReturn(false);

        assertThat(clicker.clickAt(handle, 5, 6)).isFalse();
        verify(handle).pointerClick(5, 6);
    }

    @Test(description = "A failing pointer fallback is logged, not thrown")
    public void testPointerFallbackFailure() {
        SessionHandle handle = mock(SessionHandle.class);
        doThrow(new IllegalArgumentException("out of bounds")).when(handle).pointerClick(anyLong(), anyLong());

        assertThat(clicker.clickAt(handle, 9999, 9999)).isFalse();
    }

    @Test(description = "A session that went away is reported to the caller")
    public void testUnreachableRethrown() {
        SessionHandle handle = mock(SessionHandle.class);
        doThrow(new SessionUnreachableException("gone")).when(handle).pointerClick(anyLong(), anyLong());

        assertThatThrownBy(() -> clicker.clickAt(handle, 1, 1)).isInstanceOf(SessionUnreachableException.class);
    }
}
