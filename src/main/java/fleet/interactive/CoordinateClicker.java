package fleet.interactive;

import fleet.session.SessionHandle;
import fleet.session.SessionUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches a synthetic click at a viewport coordinate inside a session.
 *
 * <p>Primary path: {@code document.elementFromPoint} and {@code element.click()},
 * falling back to dispatching a {@code MouseEvent} on that element. When the
 * page reports no element at the point, a native pointer click is tried.
 */
public class CoordinateClicker {

    private static final Logger log = LoggerFactory.getLogger(CoordinateClicker.class);

    /** arguments[0] = x, arguments[1] = y; returns true when an element was hit. */
    static final String CLICK_SCRIPT = """
            var x = arguments[0], y = arguments[1];
            var marker = document.createElement('div');
            marker.style.cssText = 'position:fixed;width:10px;height:10px;border-radius:50%;'
                + 'background:red;z-index:2147483647;pointer-events:none;'
                + 'left:' + (x - 5) + 'px;top:' + (y - 5) + 'px;';
            document.body.appendChild(marker);
            setTimeout(function () {
                marker.style.transition = 'opacity 0.5s';
                marker.style.opacity = '0';
                setTimeout(function () { if (marker.parentNode) marker.parentNode.removeChild(marker); }, 500);
            }, 500);
            var el = document.elementFromPoint(x, y);
            if (!el) return false;
            try {
                el.click();
            } catch (e) {
                el.dispatchEvent(new MouseEvent('click',
                    { view: window, bubbles: true, cancelable: true, clientX: x, clientY: y }));
            }
            return true;
            """;

    /**
     * Clicks at {@code (x, y)} in the session's active window.
     *
     * @return true when an element received the click through the page script
     * @throws SessionUnreachableException if the session is gone
     * @throws RuntimeException            if the page script itself fails
     */
    public boolean clickAt(SessionHandle handle, long x, long y) {
        Object hit = handle.runScript(CLICK_SCRIPT, x, y);
        if (Boolean.TRUE.equals(hit)) {
            log.debug("Clicked at ({}, {})", x, y);
            return true;
        }
        try {
            handle.pointerClick(x, y);
            log.debug("Clicked at ({}, {}) using pointer actions", x, y);
        } catch (SessionUnreachableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("No element found at coordinates ({}, {}): {}", x, y, e.getMessage());
        }
        return false;
    }
}
