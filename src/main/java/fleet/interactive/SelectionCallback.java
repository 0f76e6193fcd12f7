package fleet.interactive;

/** Receives the single coordinate picked in an armed session. */
@FunctionalInterface
public interface SelectionCallback {
    void onSelected(int sessionIndex, long x, long y);
}
