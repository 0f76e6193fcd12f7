package fleet.interactive;

/** Coordinate-selection state of one session: {@code IDLE -> ARMED -> SELECTED -> IDLE}. */
public enum BridgeState {
    IDLE, ARMED, SELECTED
}
