package fleet.session;

import java.util.Locale;

/** Browser engines a {@link SessionFactory} can start. */
public enum BrowserKind {
    CHROME, EDGE, FIREFOX;

    /**
     * Parses a CLI/config value such as {@code "chrome"}; unknown values fall
     * back to {@link #CHROME}.
     */
    public static BrowserKind parse(String value) {
        if (value == null || value.isBlank()) return CHROME;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CHROME;
        }
    }
}
