package fleet.interactive;

import fleet.session.SessionHandle;
import fleet.session.SessionUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * {@link SelectionMailbox} that lives in the page as one global slot
 * ({@code window.__fleetSelection}) written by an injected overlay.
 *
 * <p>The overlay is a transparent full-viewport layer with a crosshair cursor.
 * Its first primary-button click stores the viewport coordinate in the slot,
 * suppresses the page's own handling, flashes a red marker and removes the
 * layer, so a second click has no effect.
 */
public class ScriptMailbox implements SelectionMailbox {

    private static final Logger log = LoggerFactory.getLogger(ScriptMailbox.class);

    static final String OVERLAY_ID = "fleet-selection-overlay";
    static final String BANNER_ID  = "fleet-selection-banner";

    /** arguments[0] = session index. */
    static final String INSTALL_SCRIPT = """
            window.__fleetSelection = null;
            var banner = document.getElementById('fleet-selection-banner');
            if (!banner) {
                banner = document.createElement('div');
                banner.id = 'fleet-selection-banner';
                banner.style.cssText = 'position:fixed;top:10px;left:50%;transform:translateX(-50%);'
                    + 'background:rgba(0,0,0,0.8);color:white;padding:10px 15px;border-radius:5px;'
                    + 'z-index:2147483647;font-family:Arial,sans-serif;pointer-events:none;';
                document.body.appendChild(banner);
            }
            banner.textContent = 'Session ' + (arguments[0] + 1)
                + ': click anywhere to select a position for automated clicking';
            var overlay = document.getElementById('fleet-selection-overlay');
            if (!overlay) {
                overlay = document.createElement('div');
                overlay.id = 'fleet-selection-overlay';
                overlay.style.cssText = 'position:fixed;top:0;left:0;width:100%;height:100%;'
                    + 'z-index:2147483646;background:transparent;cursor:crosshair;pointer-events:auto;';
                document.body.appendChild(overlay);
            }
            window.__fleetSelectionHandler = function (e) {
                if (e.button !== 0) return;
                e.preventDefault();
                e.stopPropagation();
                var x = Math.round(e.clientX), y = Math.round(e.clientY);
                window.__fleetSelection = { x: x, y: y };
                banner.textContent = 'Selected position: (' + x + ', ' + y + ')';
                var marker = document.createElement('div');
                marker.style.cssText = 'position:fixed;width:10px;height:10px;border-radius:50%;'
                    + 'background:red;z-index:2147483647;pointer-events:none;'
                    + 'left:' + (x - 5) + 'px;top:' + (y - 5) + 'px;';
                document.body.appendChild(marker);
                setTimeout(function () {
                    marker.style.transition = 'opacity 0.5s ease-out';
                    marker.style.opacity = '0';
                    setTimeout(function () { if (marker.parentNode) marker.parentNode.removeChild(marker); }, 500);
                }, 1000);
                overlay.removeEventListener('click', window.__fleetSelectionHandler);
                if (overlay.parentNode) overlay.parentNode.removeChild(overlay);
            };
            overlay.addEventListener('click', window.__fleetSelectionHandler);
            return true;
            """;

    static final String TAKE_SCRIPT = """
            var s = window.__fleetSelection || null;
            window.__fleetSelection = null;
            return s;
            """;

    static final String REMOVE_SCRIPT = """
            var overlay = document.getElementById('fleet-selection-overlay');
            if (overlay) {
                if (window.__fleetSelectionHandler) {
                    overlay.removeEventListener('click', window.__fleetSelectionHandler);
                }
                if (overlay.parentNode) overlay.parentNode.removeChild(overlay);
            }
            delete window.__fleetSelectionHandler;
            var banner = document.getElementById('fleet-selection-banner');
            if (banner && banner.parentNode) banner.parentNode.removeChild(banner);
            return true;
            """;

    @Override
    public void install(SessionHandle handle, int sessionIndex) {
        handle.runScript(INSTALL_SCRIPT, sessionIndex);
        log.info("Selection overlay installed in session {}", sessionIndex);
    }

    @Override
    public Optional<ViewportPoint> take(SessionHandle handle) {
        Object raw = handle.runScript(TAKE_SCRIPT);
        if (!(raw instanceof Map<?, ?> slot)) {
            return Optional.empty();
        }
        Object x = slot.get("x");
        Object y = slot.get("y");
        if (!(x instanceof Number nx) || !(y instanceof Number ny)) {
            log.warn("Ignoring malformed selection slot content: {}", slot);
            return Optional.empty();
        }
        return Optional.of(new ViewportPoint(Math.round(nx.doubleValue()), Math.round(ny.doubleValue())));
    }

    @Override
    public void remove(SessionHandle handle) {
        try {
            handle.runScript(REMOVE_SCRIPT);
        } catch (SessionUnreachableException e) {
            log.debug("Selection overlay not removed, session gone: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not remove selection overlay: {}", e.getMessage());
        }
    }
}
