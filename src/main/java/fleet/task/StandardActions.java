package fleet.task;

import fleet.FleetException;
import fleet.session.LocatorKind;
import fleet.session.SessionHandle;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in task bodies for the replayable action kinds, plus factory methods
 * that wrap them in ready-to-submit {@link BrowserTask}s.
 *
 * <p>Defaults ({@link #DEFAULT_TIMEOUT_SEC}, {@link #DEFAULT_SCROLL_PX}) are
 * applied when the action runs, so a recorded task keeps exactly the
 * parameters its author supplied.
 */
public final class StandardActions {

    public static final int DEFAULT_TIMEOUT_SEC = 10;
    public static final int DEFAULT_SCROLL_PX   = 300;

    static final String KW_TIMEOUT = "timeout";
    static final String KW_BY      = "by";

    private StandardActions() { }

    // ── Action bodies ─────────────────────────────────────────────────────

    /** {@code args = [url]} */
    public static final TaskAction NAVIGATE = (session, args, kwargs) -> {
        session.navigate(requireString(args, 0, "navigate", "url"));
        return null;
    };

    /** {@code args = [selector]}, {@code kwargs = {timeout?, by?}} */
    public static final TaskAction CLICK = (session, args, kwargs) -> {
        session.click(requireString(args, 0, "click", "selector"), locatorKind(kwargs), timeout(kwargs));
        return null;
    };

    /** {@code args = [selector, text]}, {@code kwargs = {timeout?, by?}} */
    public static final TaskAction FILL = (session, args, kwargs) -> {
        String selector = requireString(args, 0, "fill", "selector");
        Object text = args.size() > 1 ? args.get(1) : "";
        session.fill(selector, text == null ? "" : text.toString(), locatorKind(kwargs), timeout(kwargs));
        return null;
    };

    /** {@code args = [amount?]}: scrolls the page vertically by {@code amount} pixels. */
    public static final TaskAction SCROLL = (session, args, kwargs) -> {
        long amount = args.isEmpty() || args.get(0) == null
                ? DEFAULT_SCROLL_PX
                : toNumber(args.get(0), "scroll amount").longValue();
        session.runScript("window.scrollBy(0, arguments[0]);", amount);
        return null;
    };

    /** {@code args = [seconds]}: pauses the chain. */
    public static final TaskAction WAIT = (session, args, kwargs) -> {
        double seconds = args.isEmpty() ? 1.0 : toNumber(args.get(0), "wait seconds").doubleValue();
        Thread.sleep((long) (seconds * 1000));
        return null;
    };

    // ── Task factories ────────────────────────────────────────────────────

    public static BrowserTask navigate(String name, String url) {
        return new BrowserTask(name, ActionKind.NAVIGATE, "Navigate to " + url,
                List.of(url), Map.of(), NAVIGATE);
    }

    public static BrowserTask click(String name, String selector, int timeoutSec) {
        return new BrowserTask(name, ActionKind.CLICK, "Click " + selector,
                List.of(selector), Map.of(KW_TIMEOUT, timeoutSec), CLICK);
    }

    public static BrowserTask fill(String name, String selector, String text) {
        return new BrowserTask(name, ActionKind.FILL, "Fill " + selector,
                List.of(selector, text), Map.of(), FILL);
    }

    public static BrowserTask scroll(String name, int amount) {
        return new BrowserTask(name, ActionKind.SCROLL, "Scroll by " + amount + "px",
                List.of(amount), Map.of(), SCROLL);
    }

    public static BrowserTask waitFor(String name, double seconds) {
        return new BrowserTask(name, ActionKind.WAIT, "Wait " + seconds + "s",
                List.of(seconds), Map.of(), WAIT);
    }

    /**
     * Returns the standard body for a replayable kind.
     *
     * @throws IllegalArgumentException for {@link ActionKind#CUSTOM}
     */
    public static TaskAction forKind(ActionKind kind) {
        return switch (kind) {
            case NAVIGATE -> NAVIGATE;
            case CLICK    -> CLICK;
            case FILL     -> FILL;
            case SCROLL   -> SCROLL;
            case WAIT     -> WAIT;
            case CUSTOM   -> throw new IllegalArgumentException("CUSTOM actions have no standard body");
        };
    }

    // ── Parameter helpers ─────────────────────────────────────────────────

    private static String requireString(List<Object> args, int i, String action, String what) {
        if (args.size() <= i || args.get(i) == null || args.get(i).toString().isBlank()) {
            throw new FleetException(action + " task requires a " + what + " at position " + i);
        }
        return args.get(i).toString();
    }

    static Duration timeout(Map<String, Object> kwargs) {
        Object raw = kwargs.get(KW_TIMEOUT);
        if (raw == null) return Duration.ofSeconds(DEFAULT_TIMEOUT_SEC);
        return Duration.ofMillis((long) (toNumber(raw, KW_TIMEOUT).doubleValue() * 1000));
    }

    static LocatorKind locatorKind(Map<String, Object> kwargs) {
        Object raw = kwargs.get(KW_BY);
        if (raw instanceof LocatorKind kind) return kind;
        if (raw == null) return LocatorKind.CSS;
        try {
            return LocatorKind.valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new FleetException("Unknown locator kind: " + raw);
        }
    }

    private static Number toNumber(Object raw, String what) {
        if (raw instanceof Number n) return n;
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new FleetException("Invalid " + what + ": '" + raw + "'");
        }
    }
}
