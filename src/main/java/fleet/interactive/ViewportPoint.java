package fleet.interactive;

/** A viewport-relative pixel coordinate inside one session's active window. */
public record ViewportPoint(long x, long y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
