package fleet.task;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of action kinds a task can declare. The kind drives how a
 * recorded task is reconstructed on replay; {@link #CUSTOM} tasks carry only
 * metadata and cannot be replayed.
 */
public enum ActionKind {
    NAVIGATE, CLICK, FILL, WAIT, SCROLL, CUSTOM;

    /** Lower-case name used in recording files, e.g. {@code "navigate"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a recording-file value back to a kind.
     *
     * @return the kind, or empty when {@code value} is null or not one of the six names
     */
    public static Optional<ActionKind> fromWire(String value) {
        if (value == null) return Optional.empty();
        for (ActionKind kind : values()) {
            if (kind.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
